package com.tandem.sync;

/**
 * Lifecycle status of an execution as recorded by the execution store.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }
}
