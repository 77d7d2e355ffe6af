package com.trace.registry.api;

import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.core.model.TraceRecord;

/**
 * Reply to a stop call. Stopping an already-stopped trace returns the same shape,
 * with {@code changed} false.
 *
 * @param id      trace identifier
 * @param calls   call count at the time of the stop
 * @param options stored options for the trace
 * @param changed whether this call moved the trace from running to stopped
 * @param <K>     identifier type
 */
public record StopResult<K>(K id, int calls, TraceOptions options, boolean changed) {

    public static <K> StopResult<K> stopped(TraceRecord<K> record) {
        return new StopResult<>(record.id(), record.calls(), record.options(), true);
    }

    public static <K> StopResult<K> alreadyStopped(TraceRecord<K> record) {
        return new StopResult<>(record.id(), record.calls(), record.options(), false);
    }
}
