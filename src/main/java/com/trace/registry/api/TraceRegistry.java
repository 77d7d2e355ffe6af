package com.trace.registry.api;

import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.core.model.TraceRecord;
import com.trace.registry.health.HealthStatus;

import java.util.List;
import java.util.Optional;

/**
 * In-process registry of trace sessions, each with a call budget and a running flag.
 *
 * <p>A profiler calls {@link #startOrAdvance} before invoking a traced function and
 * {@link #stop} once it returns. Each start after a stop counts one call. The start that
 * brings the count to the budget replies {@link StartStatus#END_TRACE}, which tells the
 * caller to finalize and report the trace.</p>
 *
 * <p>Every operation is atomic with respect to every other operation on the same
 * registry, whatever key it touches.</p>
 *
 * <pre>
 * try (TraceRegistry&lt;String&gt; registry = TraceRegistry.&lt;String&gt;builder().build()) {
 *     StartResult&lt;String&gt; start = registry.startOrAdvance("checkout", 3, TraceOptions.empty());
 *     try {
 *         checkout();
 *     } finally {
 *         registry.stop("checkout");
 *     }
 *     if (start.isEndTrace()) {
 *         report(start.calls(), start.options());
 *     }
 * }
 * </pre>
 *
 * @param <K> trace identifier type; compared with {@code equals}/{@code hashCode}
 */
public interface TraceRegistry<K> extends AutoCloseable {

    /**
     * Starts a trace or advances a stopped one.
     *
     * <ul>
     *   <li>unknown id: creates a running record with zero calls ({@link StartStatus#CREATED})</li>
     *   <li>stopped, same budget and options: counts a call and re-arms the trace
     *       ({@link StartStatus#ADVANCED} or {@link StartStatus#END_TRACE})</li>
     *   <li>running: no change ({@link StartStatus#ALREADY_RUNNING})</li>
     *   <li>stopped, different budget or options: handled per the configured mismatch policy</li>
     * </ul>
     *
     * @param id       trace identifier
     * @param maxCalls call budget, must be positive
     * @param options  opaque options; {@code null} is treated as {@link TraceOptions#empty()}
     * @throws TraceMismatchException          stopped trace restarted with other settings under the reject policy
     * @throws TraceCapacityExceededException  a new trace would exceed the configured maximum
     * @throws RegistryUnavailableException    the registry is closed or did not answer in time
     */
    StartResult<K> startOrAdvance(K id, int maxCalls, TraceOptions options);

    /**
     * Stops a trace. Stopping a trace that is already stopped is not an error and
     * returns the same call count and options.
     *
     * @throws UnknownTraceException       no record exists for the id
     * @throws RegistryUnavailableException the registry is closed or did not answer in time
     */
    StopResult<K> stop(K id);

    /**
     * Returns the current record for the id, if any.
     */
    Optional<TraceRecord<K>> find(K id);

    /**
     * Returns a snapshot of all live records, in no particular order.
     */
    List<TraceRecord<K>> traces();

    /**
     * Removes a trace from the registry. A later start for the same id creates a fresh record.
     *
     * @return the removed record, or empty if the id was unknown
     */
    Optional<TraceRecord<K>> remove(K id);

    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Aggregate health of the registry and its worker.
     */
    HealthStatus health();

    @Override
    void close();

    static <K> TraceRegistryBuilder<K> builder() {
        return new TraceRegistryBuilder<>();
    }
}
