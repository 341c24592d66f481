package org.huang.origin.api.route;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 路由主机名的通配策略。Subdomain 表示主机名参与子域名通配匹配，此时不会分配主机名。
 */
public enum WildcardPolicy {
    NONE("None"),
    SUBDOMAIN("Subdomain");

    private final String value;

    WildcardPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static WildcardPolicy fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        for (WildcardPolicy policy : values()) {
            if (policy.value.equals(value)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("unknown wildcard policy: " + value);
    }
}
