package com.trace.registry.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RegistryConfigTest {

    @Test
    @DisplayName("Should create default config")
    void testDefaults() {
        RegistryConfig config = RegistryConfig.defaults();

        assertEquals(RegistryMode.LOCKING, config.mode());
        assertEquals(MismatchPolicy.REJECT, config.mismatchPolicy());
        assertEquals(0, config.maxTraces());
        assertFalse(config.isBounded());
        assertFalse(config.expiresIdleTraces());
        assertEquals(Duration.ofSeconds(5), config.callTimeout());
    }

    @Test
    @DisplayName("toBuilder() should copy every field")
    void testToBuilder() {
        RegistryConfig original = RegistryConfig.builder()
                .mode(RegistryMode.SERIAL)
                .mismatchPolicy(MismatchPolicy.RESTART)
                .maxTraces(10)
                .expireAfterIdle(Duration.ofMinutes(1))
                .callTimeout(Duration.ofMillis(250))
                .build();

        assertEquals(original, original.toBuilder().build());
        assertTrue(original.isBounded());
        assertTrue(original.expiresIdleTraces());
    }

    @Test
    @DisplayName("Should reject negative maxTraces")
    void testNegativeMaxTraces() {
        assertThrows(IllegalArgumentException.class,
                () -> RegistryConfig.builder().maxTraces(-1).build());
    }

    @Test
    @DisplayName("Should reject negative idle expiry")
    void testNegativeExpiry() {
        assertThrows(IllegalArgumentException.class,
                () -> RegistryConfig.builder().expireAfterIdle(Duration.ofSeconds(-1)).build());
    }

    @Test
    @DisplayName("Should reject zero call timeout")
    void testZeroCallTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> RegistryConfig.builder().callTimeout(Duration.ZERO).build());
    }

    @Test
    @DisplayName("Should reject null mode")
    void testNullMode() {
        assertThrows(NullPointerException.class,
                () -> RegistryConfig.builder().mode(null).build());
    }
}
