package com.trace.registry.registry;

import com.trace.registry.api.RegistryUnavailableException;
import com.trace.registry.api.StartResult;
import com.trace.registry.api.StopResult;
import com.trace.registry.api.TraceRegistry;
import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.core.model.TraceRecord;
import com.trace.registry.health.HealthCheckRegistry;
import com.trace.registry.health.HealthStatus;
import com.trace.registry.health.RegistryHealthCheck;
import com.trace.registry.logging.LogContext;
import com.trace.registry.metrics.MetricsService;
import com.trace.registry.tracing.Span;
import com.trace.registry.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Shared plumbing for registry implementations: argument checks, spans, timing,
 * MDC, health and the open/closed lifecycle. Subclasses only decide how an operation
 * reaches the single serialization point, via {@link #serialize(Supplier)}.
 */
public abstract class AbstractTraceRegistry<K> implements TraceRegistry<K> {
    private static final Logger log = LoggerFactory.getLogger(AbstractTraceRegistry.class);

    static final String OPERATION_START = "start";
    static final String OPERATION_STOP = "stop";
    static final String SPAN_PREFIX = "trace_registry.";
    static final String ATTR_TRACE_ID = "trace.id";

    private static final AtomicInteger REGISTRY_SEQUENCE = new AtomicInteger();

    protected final TraceStateMachine<K> stateMachine;
    protected final RegistryConfig config;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final HealthCheckRegistry healthChecks = new HealthCheckRegistry();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final String name = "trace-registry-" + REGISTRY_SEQUENCE.incrementAndGet();

    protected AbstractTraceRegistry(TraceStateMachine<K> stateMachine, MetricsService metrics,
                                    TracingService tracing) {
        this.stateMachine = stateMachine;
        this.config = stateMachine.config();
        this.metrics = metrics;
        this.tracing = tracing;
        metrics.registerActiveTraces(name, stateMachine::estimatedSize);
        healthChecks.register(new RegistryHealthCheck(stateMachine, this::isOpen));
    }

    /**
     * Runs {@code operation} with exclusive access to the state machine and returns its result.
     * Exceptions thrown by the operation propagate unchanged.
     */
    protected abstract <T> T serialize(Supplier<T> operation);

    /**
     * Releases the serialization point. Called once, after the registry is marked closed.
     */
    protected abstract void shutdown();

    @Override
    public StartResult<K> startOrAdvance(K id, int maxCalls, TraceOptions options) {
        TraceStateMachine.validateStart(id, maxCalls);
        return instrument(OPERATION_START, id,
                () -> serialize(startOperation(id, maxCalls, options)),
                AbstractTraceRegistry::describeStart);
    }

    @Override
    public StopResult<K> stop(K id) {
        requireId(id);
        return instrument(OPERATION_STOP, id,
                () -> serialize(stopOperation(id)),
                AbstractTraceRegistry::describeStop);
    }

    @Override
    public Optional<TraceRecord<K>> find(K id) {
        requireId(id);
        return serialize(() -> stateMachine.find(id));
    }

    @Override
    public List<TraceRecord<K>> traces() {
        return serialize(stateMachine::traces);
    }

    @Override
    public Optional<TraceRecord<K>> remove(K id) {
        requireId(id);
        return serialize(() -> {
            try (LogContext ctx = LogContext.forRemoval(id)) {
                return stateMachine.remove(id);
            }
        });
    }

    @Override
    public int size() {
        return serialize(stateMachine::size);
    }

    @Override
    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    /**
     * Process-unique name, used as the {@code registry} tag of per-registry metrics.
     */
    public String name() {
        return name;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            int remaining = stateMachine.estimatedSize();
            shutdown();
            metrics.unregisterActiveTraces(name);
            log.info("Trace registry {} closed ({} traces discarded)", name, remaining);
        }
    }

    protected HealthCheckRegistry healthChecks() {
        return healthChecks;
    }

    protected void ensureOpen() {
        if (closed.get()) {
            throw new RegistryUnavailableException("Trace registry is closed");
        }
    }

    protected Supplier<StartResult<K>> startOperation(K id, int maxCalls, TraceOptions options) {
        return () -> {
            try (LogContext ctx = LogContext.forStart(id, maxCalls)) {
                return stateMachine.startOrAdvance(id, maxCalls, options);
            }
        };
    }

    protected Supplier<StopResult<K>> stopOperation(K id) {
        return () -> {
            try (LogContext ctx = LogContext.forStop(id)) {
                return stateMachine.stop(id);
            }
        };
    }

    protected <T> T instrument(String operation, Object id, Supplier<T> call, BiConsumer<Span, T> describe) {
        long startNanos = System.nanoTime();
        Span span = tracing.startSpan(SPAN_PREFIX + operation, Map.of(ATTR_TRACE_ID, String.valueOf(id)));
        try {
            T result = call.get();
            describe.accept(span, result);
            span.setStatus(Span.SpanStatus.OK);
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(Span.SpanStatus.ERROR);
            throw e;
        } finally {
            span.close();
            metrics.recordOperationDuration(operation, Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    protected <T> CompletableFuture<T> instrumentAsync(String operation, Object id,
                                                       Supplier<CompletableFuture<T>> call,
                                                       BiConsumer<Span, T> describe) {
        long startNanos = System.nanoTime();
        Span span = tracing.startSpan(SPAN_PREFIX + operation, Map.of(ATTR_TRACE_ID, String.valueOf(id)));
        return call.get().whenComplete((result, error) -> {
            if (error != null) {
                span.recordException(unwrap(error));
                span.setStatus(Span.SpanStatus.ERROR);
            } else {
                describe.accept(span, result);
                span.setStatus(Span.SpanStatus.OK);
            }
            span.close();
            metrics.recordOperationDuration(operation, Duration.ofNanos(System.nanoTime() - startNanos));
        });
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static void describeStart(Span span, StartResult<?> result) {
        span.setAttribute("trace.status", result.status().name());
        span.setAttribute("trace.calls", result.calls());
        span.setAttribute("trace.end", result.isEndTrace());
    }

    static void describeStop(Span span, StopResult<?> result) {
        span.setAttribute("trace.calls", result.calls());
        span.setAttribute("trace.changed", result.changed());
    }

    private static void requireId(Object id) {
        Objects.requireNonNull(id, "id must not be null");
    }
}
