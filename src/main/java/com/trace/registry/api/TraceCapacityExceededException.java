package com.trace.registry.api;

/**
 * Thrown when a new trace would exceed the configured maximum number of live traces.
 * Existing traces are never evicted to make room.
 */
public class TraceCapacityExceededException extends TraceRegistryException {

    private final long maxTraces;

    public TraceCapacityExceededException(Object traceId, long maxTraces) {
        super("Cannot start trace " + traceId + ": registry already holds " + maxTraces + " traces");
        this.maxTraces = maxTraces;
    }

    public long getMaxTraces() {
        return maxTraces;
    }
}
