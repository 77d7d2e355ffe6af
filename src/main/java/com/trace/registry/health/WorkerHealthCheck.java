package com.trace.registry.health;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Health of the worker thread behind a serial registry.
 * DOWN once the worker is shut down, DEGRADED while its request backlog is large.
 */
public class WorkerHealthCheck implements HealthCheck {

    static final int BACKLOG_WARNING_THRESHOLD = 1_000;

    private final ThreadPoolExecutor worker;

    public WorkerHealthCheck(ThreadPoolExecutor worker) {
        this.worker = worker;
    }

    @Override
    public String name() {
        return "trace-registry-worker";
    }

    @Override
    public HealthStatus check() {
        if (worker.isShutdown()) {
            return HealthStatus.down("Worker is shut down");
        }

        int queued = worker.getQueue().size();
        HealthStatus status = queued >= BACKLOG_WARNING_THRESHOLD
                ? HealthStatus.degraded(queued + " requests waiting for the worker")
                : HealthStatus.up();

        return status
                .withDetail("queued", queued)
                .withDetail("active", worker.getActiveCount())
                .withDetail("completed", worker.getCompletedTaskCount());
    }
}
