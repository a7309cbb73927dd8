package io.jobargs4j.core;

public enum ExecutionMode {
    /**
     * Executed in the caller's thread, without a wire round trip.
     */
    SYNCHRONOUS,

    /**
     * Executed by a broker from a previously submitted wire payload.
     */
    DISPATCHED
}
