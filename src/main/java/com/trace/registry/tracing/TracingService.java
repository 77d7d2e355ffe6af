package com.trace.registry.tracing;

import java.util.Map;

/**
 * Opens spans around registry operations.
 * {@link NoOpTracingService} is the default, so the registry runs without any tracing
 * library; {@link OpenTelemetryTracingService} bridges to OpenTelemetry.
 */
public interface TracingService {

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startSpan(String operationName) {
        return startSpan(operationName, Map.of());
    }
}
