package org.huang.origin.registry.errors;

/**
 * 钩子收到了不属于它的资源类型，说明调用方装配有误
 */
public class ResourceTypeMismatchException extends IllegalArgumentException {

    public ResourceTypeMismatchException(String message) {
        super(message);
    }
}
