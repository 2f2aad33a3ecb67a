package com.tandem.core.engine;

import com.tandem.core.model.TaskResult;

/**
 * A task reached the FAILED state: its retries are exhausted or a dependency failed.
 */
public class TaskFailedException extends TaskExecutionException {

    private final transient TaskResult result;

    public TaskFailedException(TaskResult result, Throwable cause) {
        super(result.taskId(),
                "Task %s failed after %d attempt(s): %s".formatted(result.taskId(), result.attempts(), result.error()),
                cause);
        this.result = result;
    }

    public TaskResult getResult() {
        return result;
    }

    public int getAttempts() {
        return result.attempts();
    }
}
