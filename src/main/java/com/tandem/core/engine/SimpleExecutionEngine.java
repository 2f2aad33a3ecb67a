package com.tandem.core.engine;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.core.model.EngineMetrics;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskResult;
import com.tandem.core.model.TaskState;
import com.tandem.core.model.TaskStatus;
import com.tandem.core.process.ManagedProcess;
import com.tandem.core.process.ProcessExit;
import com.tandem.core.process.ProcessSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * FIFO execution engine with a concurrency bound, dependency gating and retries.
 *
 * <p>All scheduling state is guarded by a single monitor. A dispatch pass scans
 * the queue in order and starts the earliest task whose dependencies have all
 * completed, repeating while slots remain. Tasks behind a blocked task are not
 * held back by it. A task whose dependency ended FAILED or CANCELLED fails
 * without being started.
 *
 * <p>Processes are spawned on a worker executor, never while holding the
 * monitor. Listeners, waiter futures and events are notified, in that order,
 * after the monitor is released so callbacks may call back into the engine.
 *
 * <p>Every attempt carries a generation number. Cancellation bumps the
 * generation, so an exit observed afterwards for the old attempt is ignored.
 */
public class SimpleExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(SimpleExecutionEngine.class);

    private final ProcessSpawner spawner;
    private final int maxConcurrent;
    private final int defaultMaxRetries;
    private final ExecutorService workers;
    private final EventBus eventBus;
    private final TandemMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, TaskEntry> entries = new LinkedHashMap<>();
    private final LinkedList<String> queue = new LinkedList<>();
    private final Map<String, List<CompletableFuture<TaskResult>>> waiters = new LinkedHashMap<>();

    private final List<Consumer<TaskResult>> completeHandlers = new CopyOnWriteArrayList<>();
    private final List<BiConsumer<String, Throwable>> failedHandlers = new CopyOnWriteArrayList<>();

    private final Instant startedAt = Instant.now();
    private int running;
    private int completedTasks;
    private int failedTasks;
    private int cancelledTasks;
    private long terminalDurationMs;
    private int timedTasks;
    private long totalProcessesSpawned;
    private int activeProcesses;
    private boolean shutdown;

    public SimpleExecutionEngine(ProcessSpawner spawner, int maxConcurrent) {
        this(spawner, maxConcurrent, 0, Executors.newCachedThreadPool(), null, null);
    }

    public SimpleExecutionEngine(ProcessSpawner spawner, int maxConcurrent, int defaultMaxRetries,
                                 ExecutorService workers, EventBus eventBus, TandemMetrics metrics) {
        if (maxConcurrent < 0) {
            throw new IllegalArgumentException("maxConcurrent must be >= 0, was " + maxConcurrent);
        }
        if (defaultMaxRetries < 0) {
            throw new IllegalArgumentException("defaultMaxRetries must be >= 0, was " + defaultMaxRetries);
        }
        this.spawner = spawner;
        this.maxConcurrent = maxConcurrent;
        this.defaultMaxRetries = defaultMaxRetries;
        this.workers = workers;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    @Override
    public String submitTask(Task task) {
        var notifications = new ArrayList<Runnable>();
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("Engine has been shut down");
            }
            if (entries.containsKey(task.id())) {
                throw new IllegalArgumentException("Task already submitted: " + task.id());
            }
            entries.put(task.id(), new TaskEntry(task));
            queue.addLast(task.id());
            int position = queue.size() - 1;
            log.info("Queued task {} (deps: {}, position {})", task.id(), task.dependencies(), position);
            notifications.add(() -> publish("task.queued", task.id(), Map.of("position", position)));
            dispatch(notifications);
        }
        notifications.forEach(Runnable::run);
        return task.id();
    }

    @Override
    public List<String> submitTasks(List<Task> tasks) {
        var ids = new ArrayList<String>(tasks.size());
        for (Task task : tasks) {
            ids.add(submitTask(task));
        }
        return ids;
    }

    @Override
    public CompletableFuture<TaskResult> waitForTask(String taskId) {
        synchronized (lock) {
            TaskEntry entry = entries.get(taskId);
            if (entry != null && entry.state.isTerminal()) {
                return entry.failure == null
                        ? CompletableFuture.completedFuture(entry.result)
                        : CompletableFuture.failedFuture(entry.failure);
            }
            // Unknown ids are held until a task with that id is submitted and finishes.
            var future = new CompletableFuture<TaskResult>();
            waiters.computeIfAbsent(taskId, k -> new ArrayList<>()).add(future);
            return future;
        }
    }

    @Override
    public CompletableFuture<List<TaskResult>> waitForTasks(List<String> taskIds) {
        if (taskIds.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<CompletableFuture<TaskResult>> futures = taskIds.stream().map(this::waitForTask).toList();
        var aggregate = new CompletableFuture<List<TaskResult>>();
        var remaining = new AtomicInteger(futures.size());
        for (CompletableFuture<TaskResult> future : futures) {
            future.whenComplete((result, error) -> {
                if (error != null) {
                    aggregate.completeExceptionally(unwrap(error));
                } else if (remaining.decrementAndGet() == 0) {
                    aggregate.complete(futures.stream().map(CompletableFuture::join).toList());
                }
            });
        }
        return aggregate;
    }

    @Override
    public boolean cancelTask(String taskId) {
        var notifications = new ArrayList<Runnable>();
        boolean cancelled;
        synchronized (lock) {
            cancelled = cancel(entries.get(taskId), notifications);
            if (cancelled) {
                dispatch(notifications);
            }
        }
        notifications.forEach(Runnable::run);
        return cancelled;
    }

    @Override
    public TaskStatus getTaskStatus(String taskId) {
        synchronized (lock) {
            TaskEntry entry = entries.get(taskId);
            if (entry == null) {
                return null;
            }
            return switch (entry.state) {
                case QUEUED -> TaskStatus.queued(taskId, queue.indexOf(taskId), entry.attempt);
                case RUNNING -> TaskStatus.running(taskId, entry.attempt,
                        entry.process != null ? entry.process.id() : null, entry.attemptStartedAt);
                default -> TaskStatus.terminal(entry.state, entry.result);
            };
        }
    }

    @Override
    public EngineMetrics getMetrics() {
        synchronized (lock) {
            int terminal = completedTasks + failedTasks;
            double successRate = terminal == 0 ? 1.0 : (double) completedTasks / terminal;
            double averageMs = timedTasks == 0 ? 0.0 : (double) terminalDurationMs / timedTasks;
            double elapsedSeconds = Duration.between(startedAt, Instant.now()).toMillis() / 1000.0;
            double throughput = elapsedSeconds <= 0 ? 0.0 : terminal / elapsedSeconds;
            return new EngineMetrics(
                    maxConcurrent,
                    running,
                    Math.max(0, maxConcurrent - running),
                    queue.size(),
                    completedTasks,
                    failedTasks,
                    averageMs,
                    successRate,
                    throughput,
                    totalProcessesSpawned,
                    activeProcesses);
        }
    }

    @Override
    public void onTaskComplete(Consumer<TaskResult> handler) {
        completeHandlers.add(handler);
    }

    @Override
    public void onTaskFailed(BiConsumer<String, Throwable> handler) {
        failedHandlers.add(handler);
    }

    @Override
    public void shutdown() {
        var notifications = new ArrayList<Runnable>();
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            for (TaskEntry entry : new ArrayList<>(entries.values())) {
                cancel(entry, notifications);
            }
            log.info("Engine shut down ({} completed, {} failed, {} cancelled)",
                    completedTasks, failedTasks, cancelledTasks);
        }
        notifications.forEach(Runnable::run);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // --- Scheduling (caller holds lock) ---

    private void dispatch(List<Runnable> notifications) {
        failBlockedByDependencies(notifications);
        while (!shutdown && running < maxConcurrent) {
            TaskEntry next = null;
            for (Iterator<String> it = queue.iterator(); it.hasNext(); ) {
                TaskEntry candidate = entries.get(it.next());
                if (dependenciesCompleted(candidate.task)) {
                    it.remove();
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                log.debug("Dispatch pass: {} queued, none eligible", queue.size());
                break;
            }
            start(next, notifications);
        }
    }

    /**
     * Fails queued tasks whose dependencies failed or were cancelled, repeating
     * until no further task is affected so chains fail transitively.
     */
    private void failBlockedByDependencies(List<Runnable> notifications) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Iterator<String> it = queue.iterator(); it.hasNext(); ) {
                TaskEntry entry = entries.get(it.next());
                String failedDependency = failedDependency(entry.task);
                if (failedDependency != null) {
                    it.remove();
                    String reason = "Dependency " + failedDependency + " did not complete";
                    log.warn("Task {} cannot run: {}", entry.task.id(), reason);
                    Instant now = Instant.now();
                    var result = new TaskResult(entry.task.id(), false, "", reason, -1, entry.attempt, now, now);
                    finishFailed(entry, result, null, notifications);
                    changed = true;
                }
            }
        }
    }

    private boolean dependenciesCompleted(Task task) {
        for (String dependency : task.dependencies()) {
            TaskEntry dep = entries.get(dependency);
            if (dep == null || dep.state != TaskState.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private String failedDependency(Task task) {
        for (String dependency : task.dependencies()) {
            TaskEntry dep = entries.get(dependency);
            if (dep != null && (dep.state == TaskState.FAILED || dep.state == TaskState.CANCELLED)) {
                return dependency;
            }
        }
        return null;
    }

    private void start(TaskEntry entry, List<Runnable> notifications) {
        entry.state = TaskState.RUNNING;
        entry.attempt++;
        entry.generation++;
        entry.attemptStartedAt = Instant.now();
        entry.process = null;
        running++;

        String taskId = entry.task.id();
        int attempt = entry.attempt;
        long generation = entry.generation;
        log.info("Starting task {} (attempt {}, {} running)", taskId, attempt, running);
        notifications.add(() -> publish("task.started", taskId, Map.of("attempt", attempt)));
        notifications.add(() -> {
            try {
                workers.execute(() -> launch(entry, attempt, generation));
            } catch (RejectedExecutionException e) {
                attemptEnded(entry, generation, null, null, e);
            }
        });
    }

    private boolean cancel(TaskEntry entry, List<Runnable> notifications) {
        if (entry == null || entry.state.isTerminal()) {
            return false;
        }
        entry.generation++;
        if (entry.state == TaskState.QUEUED) {
            queue.remove(entry.task.id());
        } else {
            running--;
            ManagedProcess process = entry.process;
            if (process != null) {
                notifications.add(process::terminate);
            }
        }
        String taskId = entry.task.id();
        Instant now = Instant.now();
        entry.state = TaskState.CANCELLED;
        entry.result = new TaskResult(taskId, false, "", "cancelled", -1, entry.attempt,
                entry.attemptStartedAt != null ? entry.attemptStartedAt : now, now);
        entry.failure = new TaskCancelledException(taskId);
        cancelledTasks++;
        log.info("Cancelled task {}", taskId);

        List<CompletableFuture<TaskResult>> pending = drainWaiters(taskId);
        Throwable failure = entry.failure;
        notifications.add(() -> {
            pending.forEach(f -> f.completeExceptionally(failure));
            publish("task.cancelled", taskId, Map.of());
            if (metrics != null) {
                metrics.recordTaskOutcome("cancelled");
            }
        });
        return true;
    }

    // --- Attempt lifecycle (worker threads) ---

    private void launch(TaskEntry entry, int attempt, long generation) {
        String taskId = entry.task.id();
        MdcContext.setTask(taskId, attempt);
        try {
            ManagedProcess process;
            try {
                process = spawner.spawn(entry.task, attempt);
            } catch (RuntimeException e) {
                log.error("Failed to spawn process for task {}: {}", taskId, e.getMessage());
                attemptEnded(entry, generation, null, null, e);
                return;
            }

            boolean stale;
            synchronized (lock) {
                totalProcessesSpawned++;
                activeProcesses++;
                stale = entry.generation != generation;
                if (!stale) {
                    entry.process = process;
                }
            }
            if (stale) {
                // Cancelled between dispatch and spawn; the exit below is ignored.
                process.terminate();
            }

            CompletableFuture<ProcessExit> exit = process.onExit();
            Duration timeout = entry.task.config().timeout();
            if (timeout != null) {
                exit = exit.thenApply(e -> e).orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            exit.whenComplete((processExit, error) -> attemptEnded(entry, generation, process, processExit, error));
        } finally {
            MdcContext.clear();
        }
    }

    private void attemptEnded(TaskEntry entry, long generation, ManagedProcess process,
                              ProcessExit exit, Throwable error) {
        Throwable cause = error == null ? null : unwrap(error);
        if (cause instanceof TimeoutException && process != null) {
            log.warn("Task {} timed out after {}", entry.task.id(), entry.task.config().timeout());
            process.terminate();
        }

        var notifications = new ArrayList<Runnable>();
        synchronized (lock) {
            if (process != null) {
                activeProcesses--;
            }
            if (entry.generation != generation || entry.state != TaskState.RUNNING) {
                log.debug("Ignoring exit of stale attempt for task {}", entry.task.id());
                return;
            }
            running--;

            String taskId = entry.task.id();
            Instant now = Instant.now();
            boolean success = cause == null && exit != null && exit.success();
            String output = exit != null && exit.stdout() != null ? exit.stdout() : "";
            int exitCode = exit != null ? exit.exitCode() : -1;

            if (success) {
                var result = new TaskResult(taskId, true, output, null, exitCode, entry.attempt,
                        entry.attemptStartedAt, now);
                finishCompleted(entry, result, notifications);
            } else {
                String reason = failureReason(entry.task, exit, cause);
                int maxRetries = entry.task.config().maxRetries() != null
                        ? entry.task.config().maxRetries()
                        : defaultMaxRetries;
                if (!shutdown && entry.attempt <= maxRetries) {
                    entry.state = TaskState.QUEUED;
                    entry.process = null;
                    queue.addFirst(taskId);
                    log.warn("Task {} attempt {} failed ({}), retrying ({} of {})",
                            taskId, entry.attempt, reason, entry.attempt, maxRetries);
                    int attempt = entry.attempt;
                    notifications.add(() -> {
                        publish("task.retrying", taskId, Map.of("attempt", attempt, "error", reason));
                        if (metrics != null) {
                            metrics.recordRetry();
                        }
                    });
                } else {
                    var result = new TaskResult(taskId, false, output, reason, exitCode, entry.attempt,
                            entry.attemptStartedAt, now);
                    finishFailed(entry, result, cause, notifications);
                }
            }
            dispatch(notifications);
        }
        notifications.forEach(Runnable::run);
    }

    private void finishCompleted(TaskEntry entry, TaskResult result, List<Runnable> notifications) {
        entry.state = TaskState.COMPLETED;
        entry.result = result;
        entry.process = null;
        completedTasks++;
        recordDuration(result);
        log.info("Task {} completed in {} ms after {} attempt(s)",
                result.taskId(), result.duration().toMillis(), result.attempts());

        List<CompletableFuture<TaskResult>> pending = drainWaiters(result.taskId());
        notifications.add(() -> {
            for (Consumer<TaskResult> handler : completeHandlers) {
                invokeSafely(() -> handler.accept(result));
            }
            pending.forEach(f -> f.complete(result));
            publish("task.completed", result.taskId(),
                    Map.of("attempts", result.attempts(), "durationMs", result.duration().toMillis()));
            if (metrics != null) {
                metrics.recordTaskOutcome("completed");
                metrics.recordTaskDuration(result.duration());
            }
        });
    }

    private void finishFailed(TaskEntry entry, TaskResult result, Throwable cause, List<Runnable> notifications) {
        var failure = new TaskFailedException(result, cause);
        entry.state = TaskState.FAILED;
        entry.result = result;
        entry.failure = failure;
        entry.process = null;
        failedTasks++;
        recordDuration(result);
        log.error("Task {} failed after {} attempt(s): {}", result.taskId(), result.attempts(), result.error());

        List<CompletableFuture<TaskResult>> pending = drainWaiters(result.taskId());
        notifications.add(() -> {
            for (BiConsumer<String, Throwable> handler : failedHandlers) {
                invokeSafely(() -> handler.accept(result.taskId(), failure));
            }
            pending.forEach(f -> f.completeExceptionally(failure));
            publish("task.failed", result.taskId(),
                    Map.of("attempts", result.attempts(), "error", String.valueOf(result.error())));
            if (metrics != null) {
                metrics.recordTaskOutcome("failed");
            }
        });
    }

    private void recordDuration(TaskResult result) {
        terminalDurationMs += result.duration().toMillis();
        timedTasks++;
    }

    private List<CompletableFuture<TaskResult>> drainWaiters(String taskId) {
        List<CompletableFuture<TaskResult>> pending = waiters.remove(taskId);
        return pending != null ? pending : List.of();
    }

    private static String failureReason(Task task, ProcessExit exit, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "Timed out after " + task.config().timeout().toMillis() + " ms";
        }
        if (cause != null) {
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (exit == null) {
            return "Process ended without an exit status";
        }
        String stderr = exit.stderr() != null ? exit.stderr().strip() : "";
        return stderr.isEmpty()
                ? "Process exited with code " + exit.exitCode()
                : "Process exited with code " + exit.exitCode() + ": " + stderr;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void publish(String eventType, String taskId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(TandemEvent.of(eventType, taskId, payload));
        }
    }

    private static void invokeSafely(Runnable handler) {
        try {
            handler.run();
        } catch (RuntimeException e) {
            log.warn("Task listener threw: {}", e.getMessage(), e);
        }
    }

    private static final class TaskEntry {
        private final Task task;
        private TaskState state = TaskState.QUEUED;
        private int attempt;
        private long generation;
        private Instant attemptStartedAt;
        private ManagedProcess process;
        private TaskResult result;
        private Throwable failure;

        private TaskEntry(Task task) {
            this.task = task;
        }
    }
}
