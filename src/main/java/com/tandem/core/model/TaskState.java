package com.tandem.core.model;

/**
 * Lifecycle state of a task owned by the execution engine.
 */
public enum TaskState {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
