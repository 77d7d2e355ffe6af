package com.trace.registry.metrics;

import com.trace.registry.api.StartStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntSupplier;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code trace.transitions} Counter (tag: transition)</li>
 *   <li>{@code trace.errors} Counter (tag: error)</li>
 *   <li>{@code trace.evicted} Counter</li>
 *   <li>{@code trace.operation.duration} Timer (tag: operation)</li>
 *   <li>{@code trace.active} Gauge (tag: registry)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    static final String TRANSITION_STOPPED = "stopped";
    static final String TRANSITION_ALREADY_STOPPED = "already_stopped";

    private final MeterRegistry registry;
    private final Map<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Gauge> activeTraceGauges = new ConcurrentHashMap<>();
    private final Counter unknownTraceCounter;
    private final Counter mismatchCounter;
    private final Counter capacityCounter;
    private final Counter evictionCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.unknownTraceCounter = errorCounter("unknown_trace");
        this.mismatchCounter = errorCounter("mismatch");
        this.capacityCounter = errorCounter("capacity");
        this.evictionCounter = Counter.builder("trace.evicted")
                .description("Traces removed explicitly or after idling")
                .register(registry);
    }

    @Override
    public void recordStart(StartStatus status) {
        transitionCounter(status.name().toLowerCase(Locale.ROOT)).increment();
    }

    @Override
    public void recordStop(boolean changed) {
        transitionCounter(changed ? TRANSITION_STOPPED : TRANSITION_ALREADY_STOPPED).increment();
    }

    @Override
    public void recordUnknownTrace() {
        unknownTraceCounter.increment();
    }

    @Override
    public void recordMismatch() {
        mismatchCounter.increment();
    }

    @Override
    public void recordCapacityRejected() {
        capacityCounter.increment();
    }

    @Override
    public void recordEviction() {
        evictionCounter.increment();
    }

    @Override
    public void recordOperationDuration(String operation, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(operation, op ->
                Timer.builder("trace.operation.duration")
                        .description("Time spent serving registry operations, including waiting for the lock or worker")
                        .tag("operation", op)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void registerActiveTraces(String registryName, IntSupplier activeTraces) {
        Gauge gauge = Gauge.builder("trace.active", activeTraces, IntSupplier::getAsInt)
                .description("Number of traces currently held by the registry")
                .tag("registry", registryName)
                .strongReference(true)
                .register(registry);
        activeTraceGauges.put(registryName, gauge);
    }

    @Override
    public void unregisterActiveTraces(String registryName) {
        Gauge gauge = activeTraceGauges.remove(registryName);
        if (gauge != null) {
            registry.remove(gauge);
        }
    }

    private Counter transitionCounter(String transition) {
        return transitionCounters.computeIfAbsent(transition, t ->
                Counter.builder("trace.transitions")
                        .description("Trace state transitions")
                        .tag("transition", t)
                        .register(registry));
    }

    private Counter errorCounter(String error) {
        return Counter.builder("trace.errors")
                .description("Registry operations rejected with an error")
                .tag("error", error)
                .register(registry);
    }
}
