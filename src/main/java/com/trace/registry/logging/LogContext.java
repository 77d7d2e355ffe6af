package com.trace.registry.logging;

import org.slf4j.MDC;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) scope for structured logging.
 * Sets key-value pairs in SLF4J MDC and, on close, puts back whatever those keys held before,
 * so a registry call made inside a caller's own trace context leaves that context intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forStart(traceId, maxCalls)) {
 *     log.debug("trace.advanced calls={}", calls);
 * }
 * </pre>
 *
 * <p>The serial registry opens its context on the worker thread, since MDC is thread-local.</p>
 */
public class LogContext implements AutoCloseable {

    public static final String TRACE_ID = "traceId";
    public static final String OPERATION = "operation";
    public static final String MAX_CALLS = "maxCalls";

    private final Deque<String[]> previous = new ArrayDeque<>();

    private LogContext(String operation, Object traceId) {
        put(TRACE_ID, String.valueOf(traceId));
        put(OPERATION, operation);
    }

    public static LogContext forStart(Object traceId, int maxCalls) {
        return new LogContext("start", traceId).with(MAX_CALLS, Integer.toString(maxCalls));
    }

    public static LogContext forStop(Object traceId) {
        return new LogContext("stop", traceId);
    }

    public static LogContext forRemoval(Object traceId) {
        return new LogContext("remove", traceId);
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        previous.push(new String[]{key, MDC.get(key)});
        MDC.put(key, value);
    }

    @Override
    public void close() {
        while (!previous.isEmpty()) {
            String[] entry = previous.pop();
            if (entry[1] == null) {
                MDC.remove(entry[0]);
            } else {
                MDC.put(entry[0], entry[1]);
            }
        }
    }
}
