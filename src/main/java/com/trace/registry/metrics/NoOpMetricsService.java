package com.trace.registry.metrics;

import com.trace.registry.api.StartStatus;

import java.time.Duration;
import java.util.function.IntSupplier;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStart(StartStatus status) {
    }

    @Override
    public void recordStop(boolean changed) {
    }

    @Override
    public void recordUnknownTrace() {
    }

    @Override
    public void recordMismatch() {
    }

    @Override
    public void recordCapacityRejected() {
    }

    @Override
    public void recordEviction() {
    }

    @Override
    public void recordOperationDuration(String operation, Duration duration) {
    }

    @Override
    public void registerActiveTraces(String registryName, IntSupplier activeTraces) {
    }

    @Override
    public void unregisterActiveTraces(String registryName) {
    }
}
