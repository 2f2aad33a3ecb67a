package com.tandem.core.engine;

import com.tandem.core.model.Task;
import com.tandem.core.process.ManagedProcess;
import com.tandem.core.process.ProcessExit;
import com.tandem.core.process.ProcessSpawner;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * Test spawner whose processes either exit on their own (scripted) or wait for
 * the test to finish them.
 */
class FakeSpawner implements ProcessSpawner {

    private final BiFunction<Task, Integer, ProcessExit> script;
    private final List<FakeProcess> spawned = new CopyOnWriteArrayList<>();
    private final BlockingQueue<FakeProcess> started = new LinkedBlockingQueue<>();

    /** Processes stay alive until {@link FakeProcess#exit(int)} is called. */
    FakeSpawner() {
        this(null);
    }

    /** Processes exit immediately with whatever the script returns. */
    FakeSpawner(BiFunction<Task, Integer, ProcessExit> script) {
        this.script = script;
    }

    @Override
    public ManagedProcess spawn(Task task, int attempt) {
        var process = new FakeProcess(task.id(), attempt);
        spawned.add(process);
        started.add(process);
        if (script != null) {
            process.exit.complete(script.apply(task, attempt));
        }
        return process;
    }

    /** Blocks until the next process is spawned. */
    FakeProcess nextStarted() throws InterruptedException {
        FakeProcess process = started.poll(5, TimeUnit.SECONDS);
        if (process == null) {
            throw new AssertionError("No process was spawned within 5s");
        }
        return process;
    }

    List<FakeProcess> spawned() {
        return spawned;
    }

    long spawnCount(String taskId) {
        return spawned.stream().filter(p -> p.taskId.equals(taskId)).count();
    }

    static final class FakeProcess implements ManagedProcess {
        final String taskId;
        final int attempt;
        final CompletableFuture<ProcessExit> exit = new CompletableFuture<>();
        final AtomicBoolean terminated = new AtomicBoolean();

        FakeProcess(String taskId, int attempt) {
            this.taskId = taskId;
            this.attempt = attempt;
        }

        void exit(int code) {
            exit.complete(new ProcessExit(code, "out-" + taskId, code == 0 ? "" : "boom"));
        }

        @Override
        public String id() {
            return taskId + "#" + attempt;
        }

        @Override
        public CompletableFuture<ProcessExit> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            terminated.set(true);
            exit.complete(new ProcessExit(143, "", "terminated"));
        }
    }
}
