package org.huang.origin.registry.route.allocation;

public class RouteAllocationException extends Exception {

    public RouteAllocationException(String message) {
        super(message);
    }

    public RouteAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
