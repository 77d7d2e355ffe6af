package com.trace.registry.core.model;

import java.util.Objects;

/**
 * Immutable snapshot of one trace tracked by the registry.
 * Transitions return new records; the registry swaps them into its store.
 *
 * @param id       caller-supplied trace identifier
 * @param maxCalls call budget; reaching it signals that the trace should end
 * @param calls    number of advances since the record was created
 * @param running  whether the traced function is currently in flight
 * @param options  opaque caller configuration, echoed back unchanged
 * @param <K>      identifier type
 */
public record TraceRecord<K>(K id, int maxCalls, int calls, boolean running, TraceOptions options) {

    public TraceRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(options, "options must not be null");
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be > 0");
        }
        if (calls < 0) {
            throw new IllegalArgumentException("calls must be >= 0");
        }
    }

    /**
     * Creates the record for a trace seen for the first time: no calls counted, running.
     */
    public static <K> TraceRecord<K> started(K id, int maxCalls, TraceOptions options) {
        return new TraceRecord<>(id, maxCalls, 0, true, options);
    }

    /**
     * Counts one more call and marks the trace running again.
     *
     * @throws IllegalStateException if the call count is already {@link Integer#MAX_VALUE}
     */
    public TraceRecord<K> advance() {
        if (calls == Integer.MAX_VALUE) {
            throw new IllegalStateException("Call count of trace " + id + " cannot advance past " + calls);
        }
        return new TraceRecord<>(id, maxCalls, calls + 1, true, options);
    }

    public TraceRecord<K> stop() {
        return running ? new TraceRecord<>(id, maxCalls, calls, false, options) : this;
    }

    /**
     * True when the given budget and options are structurally equal to the stored ones.
     */
    public boolean matches(int otherMaxCalls, TraceOptions otherOptions) {
        return maxCalls == otherMaxCalls && options.equals(otherOptions);
    }

    /**
     * Exact-equality check: once {@code calls} passes {@code maxCalls} it no longer reports reached.
     */
    public boolean budgetReached() {
        return calls == maxCalls;
    }

    public TraceState state() {
        return running ? TraceState.RUNNING : TraceState.STOPPED;
    }
}
