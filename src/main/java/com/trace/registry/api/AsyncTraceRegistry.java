package com.trace.registry.api;

import com.trace.registry.core.model.TraceOptions;

import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking view of a registry served by a single worker thread.
 * Requests are applied in submission order; futures complete on the worker thread
 * and fail with the same exceptions the blocking methods throw.
 */
public interface AsyncTraceRegistry<K> extends TraceRegistry<K> {

    CompletableFuture<StartResult<K>> startOrAdvanceAsync(K id, int maxCalls, TraceOptions options);

    CompletableFuture<StopResult<K>> stopAsync(K id);
}
