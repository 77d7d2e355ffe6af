package com.trace.registry.api;

import com.trace.registry.core.model.TraceOptions;

/**
 * Thrown when a stopped trace is started again with a budget or options that differ
 * from the ones it was created with, and the registry is configured to reject that.
 */
public class TraceMismatchException extends TraceRegistryException {

    private final transient Object traceId;
    private final int storedMaxCalls;
    private final int requestedMaxCalls;
    private final transient TraceOptions storedOptions;
    private final transient TraceOptions requestedOptions;

    public TraceMismatchException(Object traceId, int storedMaxCalls, TraceOptions storedOptions,
                                  int requestedMaxCalls, TraceOptions requestedOptions) {
        super("Trace " + traceId + " was created with maxCalls=" + storedMaxCalls + " options=" + storedOptions
                + " but was started with maxCalls=" + requestedMaxCalls + " options=" + requestedOptions);
        this.traceId = traceId;
        this.storedMaxCalls = storedMaxCalls;
        this.requestedMaxCalls = requestedMaxCalls;
        this.storedOptions = storedOptions;
        this.requestedOptions = requestedOptions;
    }

    public Object getTraceId() {
        return traceId;
    }

    public int getStoredMaxCalls() {
        return storedMaxCalls;
    }

    public int getRequestedMaxCalls() {
        return requestedMaxCalls;
    }

    public TraceOptions getStoredOptions() {
        return storedOptions;
    }

    public TraceOptions getRequestedOptions() {
        return requestedOptions;
    }
}
