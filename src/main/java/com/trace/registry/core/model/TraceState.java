package com.trace.registry.core.model;

/**
 * Stored state of a trace record.
 * A trace that has never been started has no record at all, so there is no
 * "non-existent" constant here.
 */
public enum TraceState {
    /**
     * The traced function is in flight. Further starts are no-ops until the trace is stopped.
     */
    RUNNING,

    /**
     * The previous invocation finished. The next start advances the call count.
     */
    STOPPED
}
