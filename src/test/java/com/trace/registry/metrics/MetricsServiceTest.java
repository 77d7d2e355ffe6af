package com.trace.registry.metrics;

import com.trace.registry.api.StartStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordStart(StartStatus.CREATED);
                noOp.recordStop(true);
                noOp.recordUnknownTrace();
                noOp.recordMismatch();
                noOp.recordCapacityRejected();
                noOp.recordEviction();
                noOp.recordOperationDuration("start", Duration.ofMillis(1));
                noOp.registerActiveTraces("r1", () -> 3);
                noOp.unregisterActiveTraces("r1");
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should count start transitions by status")
        void recordStart() {
            metrics.recordStart(StartStatus.CREATED);
            metrics.recordStart(StartStatus.ADVANCED);
            metrics.recordStart(StartStatus.ADVANCED);
            metrics.recordStart(StartStatus.END_TRACE);

            assertEquals(1.0, transitions("created").count());
            assertEquals(2.0, transitions("advanced").count());
            assertEquals(1.0, transitions("end_trace").count());
            assertNull(registry.find("trace.transitions").tag("transition", "restarted").counter());
        }

        @Test
        @DisplayName("Should distinguish real stops from repeated stops")
        void recordStop() {
            metrics.recordStop(true);
            metrics.recordStop(false);
            metrics.recordStop(false);

            assertEquals(1.0, transitions(MicrometerMetricsService.TRANSITION_STOPPED).count());
            assertEquals(2.0, transitions(MicrometerMetricsService.TRANSITION_ALREADY_STOPPED).count());
        }

        @Test
        @DisplayName("Should count errors by kind")
        void recordErrors() {
            metrics.recordUnknownTrace();
            metrics.recordUnknownTrace();
            metrics.recordMismatch();
            metrics.recordCapacityRejected();

            assertEquals(2.0, errors("unknown_trace").count());
            assertEquals(1.0, errors("mismatch").count());
            assertEquals(1.0, errors("capacity").count());
        }

        @Test
        @DisplayName("Should register error and eviction counters up front")
        void countersRegisteredEagerly() {
            assertEquals(0.0, errors("mismatch").count());
            assertEquals(0.0, registry.get("trace.evicted").counter().count());

            metrics.recordEviction();

            assertEquals(1.0, registry.get("trace.evicted").counter().count());
        }

        @Test
        @DisplayName("Should record operation durations per operation")
        void recordOperationDuration() {
            metrics.recordOperationDuration("start", Duration.ofMillis(2));
            metrics.recordOperationDuration("start", Duration.ofMillis(4));
            metrics.recordOperationDuration("stop", Duration.ofMillis(1));

            Timer start = registry.find("trace.operation.duration").tag("operation", "start").timer();
            Timer stop = registry.find("trace.operation.duration").tag("operation", "stop").timer();

            assertNotNull(start);
            assertEquals(2, start.count());
            assertNotNull(stop);
            assertEquals(1, stop.count());
        }

        @Test
        @DisplayName("Should read the active trace gauge on demand")
        void activeTracesGauge() {
            AtomicInteger active = new AtomicInteger(2);
            metrics.registerActiveTraces("r1", active::get);

            Gauge gauge = registry.find("trace.active").tag("registry", "r1").gauge();
            assertNotNull(gauge);
            assertEquals(2.0, gauge.value());

            active.set(5);
            assertEquals(5.0, gauge.value());
        }

        @Test
        @DisplayName("Each registry should get its own gauge, removed on unregister")
        void activeTracesGaugePerRegistry() {
            metrics.registerActiveTraces("r1", () -> 1);
            metrics.registerActiveTraces("r2", () -> 7);

            assertEquals(2, registry.find("trace.active").gauges().size());
            assertEquals(7.0, registry.get("trace.active").tag("registry", "r2").gauge().value());

            metrics.unregisterActiveTraces("r1");
            metrics.unregisterActiveTraces("unknown");

            assertNull(registry.find("trace.active").tag("registry", "r1").gauge());
            assertEquals(7.0, registry.get("trace.active").tag("registry", "r2").gauge().value());
        }

        private Counter transitions(String transition) {
            return registry.get("trace.transitions").tag("transition", transition).counter();
        }

        private Counter errors(String error) {
            return registry.get("trace.errors").tag("error", error).counter();
        }
    }
}
