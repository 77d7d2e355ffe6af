package com.trace.registry.registry;

/**
 * How a registry serializes access to its trace store.
 */
public enum RegistryMode {
    /**
     * Callers run operations on their own thread, one at a time, under a shared lock.
     */
    LOCKING,

    /**
     * One worker thread applies queued requests in order; callers wait for the reply
     * or use the asynchronous API.
     */
    SERIAL
}
