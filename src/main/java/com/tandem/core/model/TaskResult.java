package com.tandem.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;

/**
 * Terminal outcome of a task, shared by value with every waiter.
 *
 * @param taskId      the task
 * @param success     true if the final attempt exited cleanly
 * @param output      captured stdout of the final attempt
 * @param error       error description (stderr or failure reason), null on success
 * @param exitCode    process exit code of the final attempt, -1 if it never exited
 * @param attempts    number of attempts made
 * @param startedAt   when the final attempt started
 * @param completedAt when the terminal state was reached
 */
public record TaskResult(
    String taskId,
    boolean success,
    String output,
    String error,
    int exitCode,
    int attempts,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, completedAt);
    }
}
