package com.trace.registry.api;

/**
 * Thrown when the registry cannot serve a call: it was closed, its worker did not
 * answer within the call timeout, or the calling thread was interrupted while waiting.
 */
public class RegistryUnavailableException extends TraceRegistryException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
