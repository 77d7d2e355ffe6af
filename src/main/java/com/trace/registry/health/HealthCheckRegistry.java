package com.trace.registry.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status.
 *
 * <p>The worst status wins: any DOWN check makes the aggregate DOWN, otherwise any
 * DEGRADED check makes it DEGRADED. Each check's result is kept as a detail under its name.
 * A check that throws counts as DOWN.</p>
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String reason = null;
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.name(), result.summary());
            if (result.status().isWorseThan(worst)) {
                worst = result.status();
                reason = check.name() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, reason, results);
    }

    public int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("Health check '{}' failed", check.name(), e);
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }
}
