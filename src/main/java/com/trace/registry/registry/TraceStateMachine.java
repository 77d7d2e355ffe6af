package com.trace.registry.registry;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.trace.registry.api.StartResult;
import com.trace.registry.api.StopResult;
import com.trace.registry.api.TraceCapacityExceededException;
import com.trace.registry.api.TraceMismatchException;
import com.trace.registry.api.UnknownTraceException;
import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.core.model.TraceRecord;
import com.trace.registry.core.model.TraceState;
import com.trace.registry.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Trace lifecycle transitions over a key-indexed store of immutable {@link TraceRecord}s.
 *
 * <p>Not safe for concurrent use on its own: every check-then-replace sequence assumes the
 * caller holds the registry's single serialization point (the lock of
 * {@link LockingTraceRegistry} or the worker thread of {@link SerialTraceRegistry}).
 * The read-only {@link #estimatedSize()} and {@link #count(TraceState)} are the exception:
 * they never mutate the store, so gauges and health checks call them from any thread.</p>
 *
 * <p>Records are held in a Caffeine cache so that idle traces can expire. Without an idle
 * timeout the cache is unbounded and never drops an entry on its own.</p>
 */
public class TraceStateMachine<K> {
    private static final Logger log = LoggerFactory.getLogger(TraceStateMachine.class);

    private final Cache<K, TraceRecord<K>> traces;
    private final RegistryConfig config;
    private final MetricsService metrics;

    public TraceStateMachine(RegistryConfig config, MetricsService metrics, Ticker ticker) {
        this.config = config;
        this.metrics = metrics;
        Caffeine<K, TraceRecord<K>> builder = Caffeine.newBuilder()
                .executor(Runnable::run)
                .ticker(ticker)
                .<K, TraceRecord<K>>evictionListener(this::onEvicted);
        if (config.expiresIdleTraces()) {
            builder.expireAfterAccess(config.expireAfterIdle());
        }
        this.traces = builder.build();
    }

    public StartResult<K> startOrAdvance(K id, int maxCalls, TraceOptions options) {
        validateStart(id, maxCalls);
        TraceOptions requested = options != null ? options : TraceOptions.empty();

        TraceRecord<K> current = traces.getIfPresent(id);
        if (current == null) {
            return create(id, maxCalls, requested);
        }

        if (current.running()) {
            log.debug("trace.already_running id={} calls={}", id, current.calls());
            return record(StartResult.alreadyRunning(current));
        }

        if (!current.matches(maxCalls, requested)) {
            return onMismatch(current, maxCalls, requested);
        }

        TraceRecord<K> advanced = current.advance();
        traces.put(id, advanced);
        if (advanced.budgetReached()) {
            log.info("trace.end id={} calls={} options={}", id, advanced.calls(), advanced.options());
            return record(StartResult.endTrace(advanced));
        }
        log.debug("trace.advanced id={} calls={}/{}", id, advanced.calls(), advanced.maxCalls());
        return record(StartResult.advanced(advanced));
    }

    public StopResult<K> stop(K id) {
        Objects.requireNonNull(id, "id must not be null");

        TraceRecord<K> current = traces.getIfPresent(id);
        if (current == null) {
            metrics.recordUnknownTrace();
            log.debug("trace.unknown id={}", id);
            throw new UnknownTraceException(id);
        }

        if (!current.running()) {
            metrics.recordStop(false);
            log.debug("trace.already_stopped id={} calls={}", id, current.calls());
            return StopResult.alreadyStopped(current);
        }

        TraceRecord<K> stopped = current.stop();
        traces.put(id, stopped);
        metrics.recordStop(true);
        log.debug("trace.stopped id={} calls={}", id, stopped.calls());
        return StopResult.stopped(stopped);
    }

    /**
     * Reads a record without counting as activity for idle expiry.
     */
    public Optional<TraceRecord<K>> find(K id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(traces.policy().getIfPresentQuietly(id));
    }

    public List<TraceRecord<K>> traces() {
        return List.copyOf(traces.asMap().values());
    }

    public Optional<TraceRecord<K>> remove(K id) {
        Objects.requireNonNull(id, "id must not be null");
        TraceRecord<K> removed = traces.asMap().remove(id);
        if (removed != null) {
            metrics.recordEviction();
            log.debug("trace.removed id={} calls={}", id, removed.calls());
        }
        return Optional.ofNullable(removed);
    }

    public int size() {
        traces.cleanUp();
        return (int) traces.estimatedSize();
    }

    /**
     * Live record count without running pending maintenance, so idle traces that have
     * expired but not yet been cleaned up may still be counted.
     */
    public int estimatedSize() {
        return (int) traces.estimatedSize();
    }

    public int count(TraceState state) {
        return (int) traces.asMap().values().stream().filter(r -> r.state() == state).count();
    }

    public void clear() {
        traces.invalidateAll();
        traces.cleanUp();
    }

    public RegistryConfig config() {
        return config;
    }

    static void validateStart(Object id, int maxCalls) {
        Objects.requireNonNull(id, "id must not be null");
        if (maxCalls <= 0) {
            throw new IllegalArgumentException("maxCalls must be > 0, was " + maxCalls);
        }
    }

    private StartResult<K> create(K id, int maxCalls, TraceOptions options) {
        if (config.isBounded() && size() >= config.maxTraces()) {
            metrics.recordCapacityRejected();
            log.warn("trace.rejected id={} reason=capacity maxTraces={}", id, config.maxTraces());
            throw new TraceCapacityExceededException(id, config.maxTraces());
        }
        TraceRecord<K> created = TraceRecord.started(id, maxCalls, options);
        traces.put(id, created);
        log.debug("trace.created id={} maxCalls={}", id, maxCalls);
        return record(StartResult.created(created));
    }

    private StartResult<K> onMismatch(TraceRecord<K> current, int maxCalls, TraceOptions options) {
        if (config.mismatchPolicy() == MismatchPolicy.RESTART) {
            TraceRecord<K> restarted = TraceRecord.started(current.id(), maxCalls, options);
            traces.put(current.id(), restarted);
            log.info("trace.restarted id={} maxCalls={}->{} previousCalls={}",
                    current.id(), current.maxCalls(), maxCalls, current.calls());
            return record(StartResult.restarted(restarted));
        }
        metrics.recordMismatch();
        log.warn("trace.rejected id={} reason=mismatch storedMaxCalls={} requestedMaxCalls={}",
                current.id(), current.maxCalls(), maxCalls);
        throw new TraceMismatchException(current.id(), current.maxCalls(), current.options(), maxCalls, options);
    }

    private StartResult<K> record(StartResult<K> result) {
        metrics.recordStart(result.status());
        return result;
    }

    private void onEvicted(K id, TraceRecord<K> record, RemovalCause cause) {
        metrics.recordEviction();
        log.debug("trace.evicted id={} cause={} calls={}", id, cause, record.calls());
    }
}
