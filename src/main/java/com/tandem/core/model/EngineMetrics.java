package com.tandem.core.model;

/**
 * Immutable snapshot of execution engine counters.
 *
 * @param maxConcurrent         concurrency bound
 * @param currentlyRunning      tasks with a live attempt
 * @param availableSlots        {@code maxConcurrent - currentlyRunning}, never negative
 * @param queuedTasks           tasks waiting for a slot or a dependency
 * @param completedTasks        tasks that reached COMPLETED
 * @param failedTasks           tasks that reached FAILED
 * @param averageDurationMs     mean duration of terminal attempts in milliseconds
 * @param successRate           completed / (completed + failed), 1.0 before any terminal task
 * @param throughput            terminal tasks per second since the engine started
 * @param totalProcessesSpawned processes handed out by the spawner, retries included
 * @param activeProcesses       processes not yet exited
 */
public record EngineMetrics(
    int maxConcurrent,
    int currentlyRunning,
    int availableSlots,
    int queuedTasks,
    int completedTasks,
    int failedTasks,
    double averageDurationMs,
    double successRate,
    double throughput,
    long totalProcessesSpawned,
    int activeProcesses
) {}
