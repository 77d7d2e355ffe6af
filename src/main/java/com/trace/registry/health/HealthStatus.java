package com.trace.registry.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Health of one component, or of the registry as a whole, with optional detail values.
 *
 * @param status  overall verdict
 * @param message short human-readable reason, "OK" when healthy
 * @param details ordered detail values, never null
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    private static final String OK = "OK";

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        public boolean isWorseThan(Status other) {
            return compareTo(other) > 0;
        }
    }

    public HealthStatus {
        Objects.requireNonNull(status, "status must not be null");
        message = message != null ? message : OK;
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus up() {
        return up(OK);
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new HealthStatus(status, message, merged);
    }

    /**
     * Flattens this status into plain values, as nested under its check's name in an aggregate.
     */
    public Map<String, Object> summary() {
        return Map.of("status", status.name(), "message", message, "details", details);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}
