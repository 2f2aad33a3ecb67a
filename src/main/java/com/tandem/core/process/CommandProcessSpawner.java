package com.tandem.core.process;

import com.tandem.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Starts the configured agent executable as a local child process.
 *
 * <p>The command is passed to {@link ProcessBuilder} as a discrete argument
 * vector (never through a shell). The task prompt is written to stdin and
 * stdin is closed; stdout and stderr are drained on the supplied executor so
 * a chatty agent cannot block on a full pipe.
 */
public class CommandProcessSpawner implements ProcessSpawner {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessSpawner.class);

    private final List<String> command;
    private final Executor streamExecutor;

    public CommandProcessSpawner(List<String> command, Executor streamExecutor) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Agent command must not be empty");
        }
        this.command = List.copyOf(command);
        this.streamExecutor = streamExecutor;
    }

    @Override
    public ManagedProcess spawn(Task task, int attempt) {
        var builder = new ProcessBuilder(new ArrayList<>(command));
        if (task.workDir() != null && !task.workDir().isBlank()) {
            builder.directory(Path.of(task.workDir()).toFile());
        }
        builder.environment().putAll(task.config().env());
        builder.environment().put("TANDEM_TASK_ID", task.id());
        builder.environment().put("TANDEM_ATTEMPT", String.valueOf(attempt));

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new ProcessSpawnException(
                    "Failed to start agent process %s for task %s".formatted(command.get(0), task.id()), e);
        }
        log.info("Spawned process {} for task {} (attempt {})", process.pid(), task.id(), attempt);

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(
                () -> drain(process.getInputStream()), streamExecutor);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                () -> drain(process.getErrorStream()), streamExecutor);

        writePrompt(process, task);

        CompletableFuture<ProcessExit> exit = process.onExit()
                .thenCombine(stdout, (p, out) -> out)
                .thenCombine(stderr, (out, err) -> new ProcessExit(process.exitValue(), out, err));

        return new LocalProcess(process, exit);
    }

    private static void writePrompt(Process process, Task task) {
        try (OutputStream stdin = process.getOutputStream()) {
            if (task.prompt() != null) {
                stdin.write(task.prompt().getBytes(StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            // The process may exit before reading its input; the exit code tells the story.
            log.debug("Could not write prompt to process {} for task {}: {}",
                    process.pid(), task.id(), e.getMessage());
        }
    }

    private static String drain(InputStream stream) {
        try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            throw new java.io.UncheckedIOException(e);
        }
    }

    private record LocalProcess(Process process, CompletableFuture<ProcessExit> exit) implements ManagedProcess {

        @Override
        public String id() {
            return String.valueOf(process.pid());
        }

        @Override
        public CompletableFuture<ProcessExit> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            if (process.isAlive()) {
                log.info("Terminating process {}", process.pid());
                process.descendants().forEach(ProcessHandle::destroy);
                process.destroy();
            }
        }
    }
}
