package com.trace.registry.cdi;

import com.trace.registry.api.TraceRegistry;
import com.trace.registry.registry.MismatchPolicy;
import com.trace.registry.registry.RegistryConfig;
import com.trace.registry.registry.RegistryMode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires a process-wide trace registry from MicroProfile Config properties.
 *
 * <p>All properties are optional:</p>
 * <pre>
 * trace-registry:
 *   mode: locking              # or serial
 *   mismatch-policy: reject    # or restart
 *   max-traces: 0              # 0 = unbounded
 *   expire-after-idle-ms: 0    # 0 = never
 *   call-timeout-ms: 5000
 * </pre>
 *
 * <p>Inject it with {@code @Inject TraceRegistry<Object> registry;}. The registry is closed
 * when the application scope ends.</p>
 */
@ApplicationScoped
public class TraceRegistryProducer {

    private static final Logger log = LoggerFactory.getLogger(TraceRegistryProducer.class);

    @Inject
    @ConfigProperty(name = "trace-registry.mode", defaultValue = "locking")
    String mode;

    @Inject
    @ConfigProperty(name = "trace-registry.mismatch-policy", defaultValue = "reject")
    String mismatchPolicy;

    @Inject
    @ConfigProperty(name = "trace-registry.max-traces", defaultValue = "0")
    long maxTraces;

    @Inject
    @ConfigProperty(name = "trace-registry.expire-after-idle-ms", defaultValue = "0")
    long expireAfterIdleMs;

    @Inject
    @ConfigProperty(name = "trace-registry.call-timeout-ms", defaultValue = "5000")
    long callTimeoutMs;

    @Produces
    @ApplicationScoped
    public RegistryConfig registryConfig() {
        return RegistryConfig.builder()
                .mode(parse(RegistryMode.class, "trace-registry.mode", mode))
                .mismatchPolicy(parse(MismatchPolicy.class, "trace-registry.mismatch-policy", mismatchPolicy))
                .maxTraces(maxTraces)
                .expireAfterIdle(Duration.ofMillis(expireAfterIdleMs))
                .callTimeout(Duration.ofMillis(callTimeoutMs))
                .build();
    }

    @Produces
    @ApplicationScoped
    public TraceRegistry<Object> traceRegistry(RegistryConfig config) {
        log.info("Producing TraceRegistry: mode={} mismatchPolicy={}", config.mode(), config.mismatchPolicy());
        return TraceRegistry.builder()
                .config(config)
                .build();
    }

    public void closeRegistry(@Disposes TraceRegistry<Object> registry) {
        log.info("Closing TraceRegistry");
        registry.close();
    }

    static <E extends Enum<E>> E parse(Class<E> type, String property, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value '" + value + "' for " + property, e);
        }
    }
}
