package com.trace.registry.metrics;

import com.trace.registry.api.StartStatus;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * Interface for recording trace registry metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the registry works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordStart(StartStatus status);

    /**
     * @param changed true if the trace moved from running to stopped, false if it was already stopped
     */
    void recordStop(boolean changed);

    void recordUnknownTrace();

    void recordMismatch();

    void recordCapacityRejected();

    void recordEviction();

    void recordOperationDuration(String operation, Duration duration);

    /**
     * Publishes the number of live traces of one registry, read on demand from the supplier.
     *
     * @param registryName distinguishes registries sharing one metrics backend
     */
    void registerActiveTraces(String registryName, IntSupplier activeTraces);

    /**
     * Stops publishing the live trace count of a closed registry and releases its supplier.
     */
    void unregisterActiveTraces(String registryName);
}
