package org.huang.origin.api.fields;

import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ObjectMetaFields {

    public static final String NAME = "metadata.name";
    public static final String NAMESPACE = "metadata.namespace";

    private ObjectMetaFields() {
    }

    /**
     * 所有资源共有的可筛选字段：metadata.name，以及命名空间资源的 metadata.namespace。
     * 缺失的值以空字符串表示。
     */
    public static Map<String, String> objectMetaFieldsSet(ObjectMeta meta, boolean namespaceScoped) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(NAME, meta == null ? "" : nullToEmpty(meta.getName()));
        if (namespaceScoped) {
            fields.put(NAMESPACE, meta == null ? "" : nullToEmpty(meta.getNamespace()));
        }
        return fields;
    }

    public static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
