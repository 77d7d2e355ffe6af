package com.trace.registry.health;

import com.trace.registry.core.model.TraceState;
import com.trace.registry.registry.RegistryConfig;
import com.trace.registry.registry.TraceStateMachine;

import java.util.function.BooleanSupplier;

/**
 * Reports whether the registry is accepting calls and how close it is to its trace limit.
 *
 * <ul>
 *   <li>DOWN: the registry has been closed</li>
 *   <li>DEGRADED: a bounded registry holds at least 90% of its maximum traces</li>
 *   <li>UP: otherwise</li>
 * </ul>
 *
 * <p>Reads the store without taking the registry's serialization point, so the counts are a
 * best-effort snapshot.</p>
 */
public class RegistryHealthCheck implements HealthCheck {

    static final double CAPACITY_WARNING_RATIO = 0.90;

    private final TraceStateMachine<?> stateMachine;
    private final BooleanSupplier open;

    public RegistryHealthCheck(TraceStateMachine<?> stateMachine, BooleanSupplier open) {
        this.stateMachine = stateMachine;
        this.open = open;
    }

    @Override
    public String name() {
        return "trace-registry";
    }

    @Override
    public HealthStatus check() {
        if (!open.getAsBoolean()) {
            return HealthStatus.down("Trace registry is closed");
        }

        RegistryConfig config = stateMachine.config();
        int traces = stateMachine.estimatedSize();
        HealthStatus status;
        if (config.isBounded() && traces >= config.maxTraces() * CAPACITY_WARNING_RATIO) {
            long usagePercent = Math.round(100.0 * traces / config.maxTraces());
            status = HealthStatus.degraded("Trace registry at " + usagePercent + "% of capacity");
        } else {
            status = HealthStatus.up();
        }

        return status
                .withDetail("traces", traces)
                .withDetail("running", stateMachine.count(TraceState.RUNNING))
                .withDetail("stopped", stateMachine.count(TraceState.STOPPED))
                .withDetail("maxTraces", config.maxTraces())
                .withDetail("mode", config.mode().name());
    }
}
