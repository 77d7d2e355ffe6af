package com.trace.registry.health;

import com.trace.registry.core.model.TraceOptions;
import com.trace.registry.metrics.NoOpMetricsService;
import com.trace.registry.registry.RegistryConfig;
import com.trace.registry.registry.TraceStateMachine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories should set status and message")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("ready", HealthStatus.up("ready").message());
            assertTrue(HealthStatus.down("gone").isDown());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
        }

        @Test
        @DisplayName("withDetail() should return a copy with the extra detail")
        void withDetail() {
            HealthStatus original = HealthStatus.up();
            HealthStatus detailed = original.withDetail("traces", 3);

            assertTrue(original.details().isEmpty());
            assertEquals("OK", original.message());
            assertTrue(HealthStatus.Status.DOWN.isWorseThan(HealthStatus.Status.DEGRADED));
            assertEquals(3, detailed.details().get("traces"));
            assertThrows(UnsupportedOperationException.class, () -> detailed.details().put("x", 1));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("Empty registry should be UP")
        void emptyRegistry() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Worst status should win and every check should appear in the details")
        void worstStatusWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("busy")));
            registry.register(check("c", HealthStatus.up()));
            registry.register(null);

            HealthStatus status = registry.checkAll();

            assertEquals(3, registry.size());
            assertTrue(status.isDegraded());
            assertEquals("b: busy", status.message());
            assertEquals(Map.of("status", "UP", "message", "OK", "details", Map.of()), status.details().get("a"));
        }

        @Test
        @DisplayName("DOWN should override DEGRADED")
        void downOverridesDegraded() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.degraded("busy")));
            registry.register(check("b", HealthStatus.down("closed")));

            assertTrue(registry.checkAll().isDown());
        }

        @Test
        @DisplayName("A throwing check should count as DOWN")
        void throwingCheck() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("ok", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("probe failed");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            assertEquals("broken: Check failed: probe failed", status.message());
        }

        private HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String name() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }

    @Nested
    @DisplayName("RegistryHealthCheck")
    class RegistryHealthCheckTests {

        @Test
        @DisplayName("Should be DOWN when the registry is closed")
        void closed() {
            AtomicBoolean open = new AtomicBoolean(true);
            RegistryHealthCheck check = new RegistryHealthCheck(machine(RegistryConfig.defaults()), open::get);
            assertTrue(check.check().isUp());

            open.set(false);

            assertTrue(check.check().isDown());
        }

        @Test
        @DisplayName("Should be DEGRADED near the trace limit")
        void nearCapacity() {
            TraceStateMachine<String> machine = machine(RegistryConfig.builder().maxTraces(10).build());
            for (int i = 0; i < 8; i++) {
                machine.startOrAdvance("t" + i, 3, TraceOptions.empty());
            }
            RegistryHealthCheck check = new RegistryHealthCheck(machine, () -> true);
            assertTrue(check.check().isUp());

            machine.startOrAdvance("t8", 3, TraceOptions.empty());
            HealthStatus status = check.check();

            assertTrue(status.isDegraded());
            assertEquals("Trace registry at 90% of capacity", status.message());
            assertEquals(9, status.details().get("traces"));
            assertEquals(10L, status.details().get("maxTraces"));
        }

        @Test
        @DisplayName("Unbounded registry should never be DEGRADED")
        void unbounded() {
            TraceStateMachine<String> machine = machine(RegistryConfig.defaults());
            for (int i = 0; i < 100; i++) {
                machine.startOrAdvance("t" + i, 3, TraceOptions.empty());
            }
            assertTrue(new RegistryHealthCheck(machine, () -> true).check().isUp());
        }

        private TraceStateMachine<String> machine(RegistryConfig config) {
            return new TraceStateMachine<>(config, new NoOpMetricsService(), System::nanoTime);
        }
    }

    @Nested
    @DisplayName("WorkerHealthCheck")
    class WorkerHealthCheckTests {

        @Test
        @DisplayName("Should be DEGRADED with a large backlog and DOWN after shutdown")
        void backlogAndShutdown() throws Exception {
            ThreadPoolExecutor worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>());
            WorkerHealthCheck check = new WorkerHealthCheck(worker);
            CountDownLatch running = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            try {
                assertTrue(check.check().isUp());

                worker.execute(() -> {
                    running.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
                assertTrue(running.await(5, TimeUnit.SECONDS));
                for (int i = 0; i < WorkerHealthCheck.BACKLOG_WARNING_THRESHOLD; i++) {
                    worker.execute(() -> { });
                }

                HealthStatus status = check.check();
                assertTrue(status.isDegraded());
                assertEquals(WorkerHealthCheck.BACKLOG_WARNING_THRESHOLD, status.details().get("queued"));
            } finally {
                release.countDown();
                worker.shutdown();
                worker.awaitTermination(5, TimeUnit.SECONDS);
            }

            assertTrue(check.check().isDown());
        }
    }
}
