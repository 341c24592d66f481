package org.huang.origin.registry.errors;

public class InternalErrorException extends RuntimeException {

    public InternalErrorException(String message, Throwable cause) {
        super("Internal error occurred: " + message, cause);
    }
}
