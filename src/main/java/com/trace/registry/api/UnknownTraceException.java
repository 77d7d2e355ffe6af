package com.trace.registry.api;

/**
 * Thrown when stopping a trace id that has no record in the registry.
 */
public class UnknownTraceException extends TraceRegistryException {

    private final transient Object traceId;

    public UnknownTraceException(Object traceId) {
        super("Unknown trace: " + traceId);
        this.traceId = traceId;
    }

    public Object getTraceId() {
        return traceId;
    }
}
