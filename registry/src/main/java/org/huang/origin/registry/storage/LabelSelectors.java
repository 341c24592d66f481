package org.huang.origin.registry.storage;

import io.fabric8.kubernetes.api.model.LabelSelector;
import io.fabric8.kubernetes.api.model.LabelSelectorRequirement;

import java.util.List;
import java.util.Map;

/**
 * 对 fabric8 {@link LabelSelector} 求值。null 选择器匹配所有对象。
 */
public final class LabelSelectors {

    public static final String OP_IN = "In";
    public static final String OP_NOT_IN = "NotIn";
    public static final String OP_EXISTS = "Exists";
    public static final String OP_DOES_NOT_EXIST = "DoesNotExist";

    private LabelSelectors() {
    }

    public static boolean isEmpty(LabelSelector selector) {
        return selector == null
                || (isNullOrEmpty(selector.getMatchLabels()) && isNullOrEmpty(selector.getMatchExpressions()));
    }

    public static boolean matches(LabelSelector selector, Map<String, String> labels) {
        if (isEmpty(selector)) {
            return true;
        }
        Map<String, String> actual = labels == null ? Map.of() : labels;
        if (selector.getMatchLabels() != null) {
            for (Map.Entry<String, String> e : selector.getMatchLabels().entrySet()) {
                if (!e.getValue().equals(actual.get(e.getKey()))) {
                    return false;
                }
            }
        }
        if (selector.getMatchExpressions() != null) {
            for (LabelSelectorRequirement requirement : selector.getMatchExpressions()) {
                if (!matchesRequirement(requirement, actual)) {
                    return false;
                }
            }
        }
        return true;
    }

    static boolean matchesRequirement(LabelSelectorRequirement requirement, Map<String, String> labels) {
        String key = requirement.getKey();
        List<String> values = requirement.getValues() == null ? List.of() : requirement.getValues();
        String operator = requirement.getOperator();
        if (operator == null) {
            throw new IllegalArgumentException("label selector operator is required for key " + key);
        }
        switch (operator) {
            case OP_IN:
                return labels.containsKey(key) && values.contains(labels.get(key));
            case OP_NOT_IN:
                return !labels.containsKey(key) || !values.contains(labels.get(key));
            case OP_EXISTS:
                return labels.containsKey(key);
            case OP_DOES_NOT_EXIST:
                return !labels.containsKey(key);
            default:
                throw new IllegalArgumentException("unsupported label selector operator: " + operator);
        }
    }

    private static boolean isNullOrEmpty(Map<?, ?> map) {
        return map == null || map.isEmpty();
    }

    private static boolean isNullOrEmpty(List<?> list) {
        return list == null || list.isEmpty();
    }
}
