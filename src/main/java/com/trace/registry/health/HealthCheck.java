package com.trace.registry.health;

/**
 * A single named probe contributing to the registry's aggregate health.
 * Probes must be cheap: {@link HealthCheckRegistry} runs every probe on each health request.
 */
public interface HealthCheck {

    /**
     * Key under which this probe's result appears in the aggregate details.
     */
    String name();

    HealthStatus check();
}
