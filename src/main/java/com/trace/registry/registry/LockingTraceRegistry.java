package com.trace.registry.registry;

import com.trace.registry.metrics.MetricsService;
import com.trace.registry.tracing.TracingService;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Registry whose callers take turns on one {@link ReentrantLock}.
 * Each operation runs on the calling thread; the lock covers every key, so
 * check-then-mutate sequences never interleave. This is the default registry.
 */
public class LockingTraceRegistry<K> extends AbstractTraceRegistry<K> {

    private final ReentrantLock lock = new ReentrantLock();

    public LockingTraceRegistry(TraceStateMachine<K> stateMachine, MetricsService metrics,
                                TracingService tracing) {
        super(stateMachine, metrics, tracing);
    }

    @Override
    protected <T> T serialize(Supplier<T> operation) {
        lock.lock();
        try {
            ensureOpen();
            return operation.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected void shutdown() {
        lock.lock();
        try {
            stateMachine.clear();
        } finally {
            lock.unlock();
        }
    }
}
