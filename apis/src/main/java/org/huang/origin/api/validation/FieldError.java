package org.huang.origin.api.validation;

import lombok.Value;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 单个字段的校验错误。校验结果总是以 {@code List<FieldError>} 返回，空列表表示通过，不会以异常抛出。
 */
@Value
public class FieldError {

    ErrorType type;

    String field;

    Object badValue;

    String detail;

    public static FieldError required(FieldPath path, String detail) {
        return new FieldError(ErrorType.REQUIRED, path.toString(), null, detail);
    }

    public static FieldError invalid(FieldPath path, Object value, String detail) {
        return new FieldError(ErrorType.INVALID, path.toString(), value, detail);
    }

    public static FieldError forbidden(FieldPath path, String detail) {
        return new FieldError(ErrorType.FORBIDDEN, path.toString(), null, detail);
    }

    public static FieldError notSupported(FieldPath path, Object value, Collection<String> validValues) {
        String detail = validValues == null || validValues.isEmpty() ? null :
                "supported values: " + validValues.stream().sorted()
                        .map(v -> "\"" + v + "\"")
                        .collect(Collectors.joining(", "));
        return new FieldError(ErrorType.NOT_SUPPORTED, path.toString(), value, detail);
    }

    /**
     * 形如 {@code spec.host: Invalid value: "a_b": must be a DNS subdomain}
     */
    public String getMessage() {
        StringBuilder sb = new StringBuilder(field).append(": ").append(type.getDescription());
        if (type != ErrorType.REQUIRED && type != ErrorType.FORBIDDEN) {
            sb.append(": ");
            if (badValue instanceof String) {
                sb.append('"').append(badValue).append('"');
            } else {
                sb.append(badValue);
            }
        }
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
