package org.huang.origin.api.validation;

public enum ErrorType {
    REQUIRED("Required value"),
    INVALID("Invalid value"),
    FORBIDDEN("Forbidden"),
    NOT_SUPPORTED("Unsupported value");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
