package com.trace.registry.api;

/**
 * Transition taken by a start-or-advance call.
 * Every status except {@link #END_TRACE} tells the caller to proceed and keep tracing.
 */
public enum StartStatus {
    /**
     * First start for this id: a new record with zero calls was created.
     */
    CREATED,

    /**
     * A stopped trace was re-armed and its call count advanced, budget not yet reached.
     */
    ADVANCED,

    /**
     * The trace was already running; nothing changed.
     */
    ALREADY_RUNNING,

    /**
     * A stopped trace was started with a different budget or options and was replaced
     * by a fresh record (only under {@code MismatchPolicy.RESTART}).
     */
    RESTARTED,

    /**
     * The advance brought the call count to the budget. The caller should finalize the trace.
     */
    END_TRACE
}
