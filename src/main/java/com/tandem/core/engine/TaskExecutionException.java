package com.tandem.core.engine;

/**
 * Base class for errors delivered to task waiters.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskId;

    public TaskExecutionException(String taskId, String message, Throwable cause) {
        super(message, cause);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
