package com.trace.registry.registry;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a trace registry.
 *
 * @param mode            serialization strategy
 * @param mismatchPolicy  handling of a stopped trace restarted with other settings
 * @param maxTraces       maximum number of live traces, 0 for unbounded
 * @param expireAfterIdle drop traces untouched for this long, {@link Duration#ZERO} to keep them forever
 * @param callTimeout     how long a blocking caller waits for the serial worker
 */
public record RegistryConfig(RegistryMode mode, MismatchPolicy mismatchPolicy, long maxTraces,
                             Duration expireAfterIdle, Duration callTimeout) {

    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

    public RegistryConfig {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(mismatchPolicy, "mismatchPolicy must not be null");
        Objects.requireNonNull(expireAfterIdle, "expireAfterIdle must not be null");
        Objects.requireNonNull(callTimeout, "callTimeout must not be null");
        if (maxTraces < 0) {
            throw new IllegalArgumentException("maxTraces must be >= 0");
        }
        if (expireAfterIdle.isNegative()) {
            throw new IllegalArgumentException("expireAfterIdle must not be negative");
        }
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be > 0");
        }
    }

    /**
     * Default configuration: locking mode, reject mismatches, unbounded, no expiry, 5s call timeout.
     */
    public static RegistryConfig defaults() {
        return builder().build();
    }

    public boolean isBounded() {
        return maxTraces > 0;
    }

    public boolean expiresIdleTraces() {
        return !expireAfterIdle.isZero();
    }

    public Builder toBuilder() {
        return new Builder()
                .mode(mode)
                .mismatchPolicy(mismatchPolicy)
                .maxTraces(maxTraces)
                .expireAfterIdle(expireAfterIdle)
                .callTimeout(callTimeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private RegistryMode mode = RegistryMode.LOCKING;
        private MismatchPolicy mismatchPolicy = MismatchPolicy.REJECT;
        private long maxTraces = 0;
        private Duration expireAfterIdle = Duration.ZERO;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;

        public Builder mode(RegistryMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder mismatchPolicy(MismatchPolicy mismatchPolicy) {
            this.mismatchPolicy = mismatchPolicy;
            return this;
        }

        public Builder maxTraces(long maxTraces) {
            this.maxTraces = maxTraces;
            return this;
        }

        public Builder expireAfterIdle(Duration expireAfterIdle) {
            this.expireAfterIdle = expireAfterIdle;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(mode, mismatchPolicy, maxTraces, expireAfterIdle, callTimeout);
        }
    }
}
