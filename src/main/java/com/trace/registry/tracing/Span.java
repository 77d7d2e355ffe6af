package com.trace.registry.tracing;

/**
 * One registry operation as seen by a distributed tracing backend.
 * {@link AutoCloseable} so spans can wrap an operation in try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("trace_registry.stop")) {
 *     span.setAttribute("trace.id", id.toString());
 *     StopResult&lt;String&gt; result = stateMachine.stop(id);
 *     span.setAttribute("trace.calls", result.calls());
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
