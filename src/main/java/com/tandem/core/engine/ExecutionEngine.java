package com.tandem.core.engine;

import com.tandem.core.model.EngineMetrics;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskResult;
import com.tandem.core.model.TaskStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Schedules agent tasks under a concurrency bound, honouring dependencies,
 * retrying failed attempts and fanning completion out to any number of waiters.
 */
public interface ExecutionEngine {

    /**
     * Queues a task and runs a dispatch pass.
     *
     * @return the task id
     * @throws IllegalArgumentException if a task with the same id was already submitted
     * @throws IllegalStateException    after {@link #shutdown()}
     */
    String submitTask(Task task);

    /**
     * Queues tasks in order.
     *
     * @return task ids in submission order
     */
    List<String> submitTasks(List<Task> tasks);

    /**
     * Returns a future that completes with the task's result, or completes
     * exceptionally with {@link TaskFailedException} / {@link TaskCancelledException}.
     * Every caller gets its own future; all of them observe the same terminal outcome.
     * After the terminal state is reached the returned future is already complete.
     */
    CompletableFuture<TaskResult> waitForTask(String taskId);

    /**
     * Completes with results in the requested order once every task succeeded;
     * completes exceptionally as soon as any of them terminally fails.
     */
    CompletableFuture<List<TaskResult>> waitForTasks(List<String> taskIds);

    /**
     * Cancels a queued or running task. Killing a running process is best-effort.
     *
     * @return true if the task was cancelled, false if unknown or already terminal
     */
    boolean cancelTask(String taskId);

    /**
     * @return a status snapshot, or {@code null} for an unknown id
     */
    TaskStatus getTaskStatus(String taskId);

    /**
     * @return an immutable snapshot of engine counters
     */
    EngineMetrics getMetrics();

    void onTaskComplete(Consumer<TaskResult> handler);

    void onTaskFailed(BiConsumer<String, Throwable> handler);

    /**
     * Stops accepting tasks, cancels queued and running tasks and releases worker threads.
     */
    void shutdown();
}
