package com.trace.registry.registry;

/**
 * What to do when a stopped trace is started with a budget or options that differ
 * from the ones stored for it. Running traces ignore the arguments of further starts.
 */
public enum MismatchPolicy {
    /**
     * Fail the call with {@code TraceMismatchException}; the stored record is untouched.
     */
    REJECT,

    /**
     * Replace the stored record with a fresh running one (zero calls, new budget and options).
     */
    RESTART
}
