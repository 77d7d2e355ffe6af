package com.trace.registry.api;

/**
 * Base class for registry failures. Unchecked, like the rest of the library's errors.
 * A failed operation leaves the registry state untouched.
 */
public class TraceRegistryException extends RuntimeException {

    public TraceRegistryException(String message) {
        super(message);
    }

    public TraceRegistryException(String message, Throwable cause) {
        super(message, cause);
    }
}
