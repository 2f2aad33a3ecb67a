package com.tandem.core.model;

import java.time.Instant;

/**
 * Point-in-time view of a task's state.
 *
 * @param taskId    the task
 * @param state     current lifecycle state
 * @param position  0-based queue position (QUEUED only, otherwise null)
 * @param attempt   1-based attempt number of the current or last attempt
 * @param processId id of the running process (RUNNING only, may be null until spawned)
 * @param startedAt when the current attempt started (RUNNING only)
 * @param result    terminal result (COMPLETED / FAILED / CANCELLED only)
 */
public record TaskStatus(
    String taskId,
    TaskState state,
    Integer position,
    int attempt,
    String processId,
    Instant startedAt,
    TaskResult result
) {

    public static TaskStatus queued(String taskId, int position, int attempt) {
        return new TaskStatus(taskId, TaskState.QUEUED, position, attempt, null, null, null);
    }

    public static TaskStatus running(String taskId, int attempt, String processId, Instant startedAt) {
        return new TaskStatus(taskId, TaskState.RUNNING, null, attempt, processId, startedAt, null);
    }

    public static TaskStatus terminal(TaskState state, TaskResult result) {
        return new TaskStatus(result.taskId(), state, null, result.attempts(), null, null, result);
    }
}
