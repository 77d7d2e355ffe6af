package com.trace.registry.registry;

import com.trace.registry.api.AsyncTraceRegistry;
import com.trace.registry.api.RegistryUnavailableException;
import com.trace.registry.api.StartResult;
import com.trace.registry.api.StopResult;
import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.health.WorkerHealthCheck;
import com.trace.registry.metrics.MetricsService;
import com.trace.registry.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Registry owned by a single worker thread that applies requests in arrival order.
 *
 * <p>Blocking calls wait up to {@link RegistryConfig#callTimeout()} for their reply. A call
 * that times out is not withdrawn: the worker still applies it when its turn comes, so the
 * caller cannot tell whether the transition happened.</p>
 *
 * <p>The asynchronous methods return as soon as the request is queued.</p>
 */
public class SerialTraceRegistry<K> extends AbstractTraceRegistry<K> implements AsyncTraceRegistry<K> {
    private static final Logger log = LoggerFactory.getLogger(SerialTraceRegistry.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;
    private static final AtomicInteger WORKER_SEQUENCE = new AtomicInteger();

    private final ThreadPoolExecutor worker;

    public SerialTraceRegistry(TraceStateMachine<K> stateMachine, MetricsService metrics,
                               TracingService tracing) {
        super(stateMachine, metrics, tracing);
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), workerThreadFactory());
        healthChecks().register(new WorkerHealthCheck(worker));
        log.info("Serial trace registry started (callTimeout={}ms)", config.callTimeout().toMillis());
    }

    @Override
    public CompletableFuture<StartResult<K>> startOrAdvanceAsync(K id, int maxCalls, TraceOptions options) {
        TraceStateMachine.validateStart(id, maxCalls);
        return instrumentAsync(OPERATION_START, id,
                () -> submit(startOperation(id, maxCalls, options)),
                AbstractTraceRegistry::describeStart);
    }

    @Override
    public CompletableFuture<StopResult<K>> stopAsync(K id) {
        Objects.requireNonNull(id, "id must not be null");
        return instrumentAsync(OPERATION_STOP, id,
                () -> submit(stopOperation(id)),
                AbstractTraceRegistry::describeStop);
    }

    @Override
    protected <T> T serialize(Supplier<T> operation) {
        CompletableFuture<T> reply = submit(operation);
        try {
            return reply.get(config.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Trace registry worker did not reply within {}ms ({} requests queued)",
                    config.callTimeout().toMillis(), worker.getQueue().size());
            throw new RegistryUnavailableException(
                    "Trace registry did not reply within " + config.callTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistryUnavailableException("Interrupted while waiting for the trace registry", e);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new RegistryUnavailableException("Trace registry operation failed", cause);
        }
    }

    @Override
    protected void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Trace registry worker did not drain within {}s, {} requests dropped",
                        SHUTDOWN_TIMEOUT_SECONDS, worker.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        stateMachine.clear();
    }

    private <T> CompletableFuture<T> submit(Supplier<T> operation) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(new RegistryUnavailableException("Trace registry is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(operation, worker);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new RegistryUnavailableException("Trace registry is closed", e));
        }
    }

    private static ThreadFactory workerThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "trace-registry-worker-" + WORKER_SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
