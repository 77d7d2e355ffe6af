package com.trace.registry.api;

import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.core.model.TraceRecord;

import java.util.Objects;

/**
 * Reply to a start-or-advance call.
 *
 * <p>Either "started" (keep going) or "end trace" (the budget is exhausted and the caller
 * should finalize and report the trace). The end-trace reply carries the call count and the
 * options stored when the trace was created.</p>
 *
 * @param id      trace identifier
 * @param status  transition that was taken
 * @param calls   call count after the transition
 * @param options stored options for the trace
 * @param <K>     identifier type
 */
public record StartResult<K>(K id, StartStatus status, int calls, TraceOptions options) {

    public StartResult {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(options, "options must not be null");
    }

    static <K> StartResult<K> of(StartStatus status, TraceRecord<K> record) {
        return new StartResult<>(record.id(), status, record.calls(), record.options());
    }

    public static <K> StartResult<K> created(TraceRecord<K> record) {
        return of(StartStatus.CREATED, record);
    }

    public static <K> StartResult<K> advanced(TraceRecord<K> record) {
        return of(StartStatus.ADVANCED, record);
    }

    public static <K> StartResult<K> alreadyRunning(TraceRecord<K> record) {
        return of(StartStatus.ALREADY_RUNNING, record);
    }

    public static <K> StartResult<K> restarted(TraceRecord<K> record) {
        return of(StartStatus.RESTARTED, record);
    }

    public static <K> StartResult<K> endTrace(TraceRecord<K> record) {
        return of(StartStatus.END_TRACE, record);
    }

    public boolean isEndTrace() {
        return status == StartStatus.END_TRACE;
    }

    public boolean isStarted() {
        return status != StartStatus.END_TRACE;
    }
}
