package com.tandem.core.engine;

/**
 * A task was cancelled before it reached a terminal state on its own.
 */
public class TaskCancelledException extends TaskExecutionException {

    public TaskCancelledException(String taskId) {
        super(taskId, "Task " + taskId + " was cancelled", null);
    }
}
