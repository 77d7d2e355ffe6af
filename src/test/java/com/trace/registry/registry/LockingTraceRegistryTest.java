package com.trace.registry.registry;

import com.trace.registry.api.StartStatus;
import com.trace.registry.api.TraceRegistry;
import com.trace.registry.core.model.TraceOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LockingTraceRegistry Tests")
class LockingTraceRegistryTest extends AbstractTraceRegistryTest {

    @Override
    protected RegistryMode mode() {
        return RegistryMode.LOCKING;
    }

    @Test
    @DisplayName("Should be the default implementation")
    void defaultMode() {
        try (TraceRegistry<String> registry = TraceRegistry.<String>builder().build()) {
            assertInstanceOf(LockingTraceRegistry.class, registry);
        }
    }

    @Test
    @DisplayName("Operations should run on the calling thread")
    void runsOnCaller() {
        ObservingMetricsService metrics = new ObservingMetricsService();
        TraceRegistry<String> registry = registry(RegistryConfig.builder(), metrics, null);

        registry.startOrAdvance("t1", 3, OPTIONS);

        assertEquals(Thread.currentThread().getName(), metrics.threadName);
    }

    @Test
    @DisplayName("Concurrent first starts for one id should create it exactly once")
    void concurrentCreate() throws Exception {
        TraceRegistry<String> registry = registry(RegistryConfig.builder());
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<StartStatus>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    startGate.await();
                    return registry.startOrAdvance("shared", 3, TraceOptions.empty()).status();
                }));
            }
            startGate.countDown();

            int createdCount = 0;
            for (Future<StartStatus> future : futures) {
                StartStatus status = future.get(10, TimeUnit.SECONDS);
                if (status == StartStatus.CREATED) {
                    createdCount++;
                } else {
                    assertEquals(StartStatus.ALREADY_RUNNING, status);
                }
            }
            assertEquals(1, createdCount);
        } finally {
            executor.shutdownNow();
        }
    }
}
