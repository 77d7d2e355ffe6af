package com.trace.registry.api;

import com.github.benmanes.caffeine.cache.Ticker;
import com.trace.registry.metrics.MetricsService;
import com.trace.registry.metrics.NoOpMetricsService;
import com.trace.registry.registry.LockingTraceRegistry;
import com.trace.registry.registry.RegistryConfig;
import com.trace.registry.registry.RegistryMode;
import com.trace.registry.registry.SerialTraceRegistry;
import com.trace.registry.registry.TraceStateMachine;
import com.trace.registry.tracing.NoOpTracingService;
import com.trace.registry.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fluent builder for {@link TraceRegistry} instances.
 *
 * <pre>
 * TraceRegistry&lt;String&gt; registry = TraceRegistry.&lt;String&gt;builder()
 *     .config(RegistryConfig.builder()
 *         .mismatchPolicy(MismatchPolicy.RESTART)
 *         .expireAfterIdle(Duration.ofMinutes(30))
 *         .build())
 *     .metricsService(new MicrometerMetricsService(meterRegistry))
 *     .build();
 * </pre>
 */
public class TraceRegistryBuilder<K> {
    private static final Logger log = LoggerFactory.getLogger(TraceRegistryBuilder.class);

    private RegistryConfig config = RegistryConfig.defaults();
    private MetricsService metricsService;
    private TracingService tracingService;
    private Ticker ticker = Ticker.systemTicker();

    TraceRegistryBuilder() {
    }

    public TraceRegistryBuilder<K> config(RegistryConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        return this;
    }

    /**
     * Shortcut for changing only the serialization strategy of the current config.
     */
    public TraceRegistryBuilder<K> mode(RegistryMode mode) {
        this.config = config.toBuilder().mode(mode).build();
        return this;
    }

    public TraceRegistryBuilder<K> metricsService(MetricsService metricsService) {
        this.metricsService = metricsService;
        return this;
    }

    public TraceRegistryBuilder<K> tracingService(TracingService tracingService) {
        this.tracingService = tracingService;
        return this;
    }

    /**
     * Time source for idle expiry. Tests substitute a manual ticker.
     */
    public TraceRegistryBuilder<K> ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        return this;
    }

    public TraceRegistry<K> build() {
        return build(config);
    }

    /**
     * Builds a serial registry regardless of the configured mode, for callers that need
     * the non-blocking API. The builder's own mode is left unchanged.
     */
    public AsyncTraceRegistry<K> buildAsync() {
        return (AsyncTraceRegistry<K>) build(config.toBuilder().mode(RegistryMode.SERIAL).build());
    }

    private TraceRegistry<K> build(RegistryConfig config) {
        MetricsService metrics = metricsService != null ? metricsService : new NoOpMetricsService();
        TracingService tracing = tracingService != null ? tracingService : new NoOpTracingService();
        TraceStateMachine<K> stateMachine = new TraceStateMachine<>(config, metrics, ticker);

        TraceRegistry<K> registry = switch (config.mode()) {
            case LOCKING -> new LockingTraceRegistry<>(stateMachine, metrics, tracing);
            case SERIAL -> new SerialTraceRegistry<>(stateMachine, metrics, tracing);
        };
        log.info("Trace registry built: mode={} mismatchPolicy={} maxTraces={} expireAfterIdle={}",
                config.mode(), config.mismatchPolicy(), config.maxTraces(), config.expireAfterIdle());
        return registry;
    }
}
