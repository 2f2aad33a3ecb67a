package com.tandem.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tandem.config.TandemProperties;
import com.tandem.core.engine.ExecutionEngine;
import com.tandem.core.engine.ExecutionEngineFactory;
import com.tandem.core.events.EventBus;
import com.tandem.core.model.Task;
import com.tandem.core.model.TaskStatus;
import com.tandem.sync.ExecutionRecord;
import com.tandem.sync.ExecutionRecordStore;
import com.tandem.sync.ExecutionStatus;
import com.tandem.worktree.GitCommandException;
import com.tandem.worktree.WorktreeManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * CLI command: tandem run &lt;tasks.json&gt;
 * <p>
 * Submits the tasks in the file to an execution engine and waits for all of
 * them. With {@code --worktrees} each task runs in its own worktree branched
 * from the target branch; its changes are committed when it completes and an
 * execution record is kept so the branch can be synced later. Task starts,
 * retries and failures are printed as they happen.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run agent tasks from a JSON file")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", description = "JSON array of task definitions")
    private File tasksFile;

    @Option(names = {"--max-concurrent", "-c"}, description = "Concurrency bound (default: tandem.engine.max-concurrent)")
    private Integer maxConcurrent;

    @Option(names = {"--worktrees", "-w"}, description = "Run each task in its own git worktree")
    private boolean worktrees;

    @Option(names = {"--target", "-t"}, description = "Branch worktrees start from (default: ${DEFAULT-VALUE})",
            defaultValue = "main")
    private String targetBranch;

    private final ExecutionEngineFactory engineFactory;
    private final WorktreeManager worktreeManager;
    private final ExecutionRecordStore records;
    private final TandemProperties properties;
    private final ObjectMapper objectMapper;
    private final EventBus eventBus;

    public RunCommand(ExecutionEngineFactory engineFactory, WorktreeManager worktreeManager,
                      ExecutionRecordStore records, TandemProperties properties, ObjectMapper objectMapper,
                      EventBus eventBus) {
        this.engineFactory = engineFactory;
        this.worktreeManager = worktreeManager;
        this.records = records;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<TaskDefinition> definitions;
        try {
            definitions = objectMapper.readValue(tasksFile, new TypeReference<List<TaskDefinition>>() {});
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read task file " + tasksFile + ": " + e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }
        if (definitions == null || definitions.isEmpty()) {
            ConsoleOutput.info("No tasks in " + tasksFile);
            return TandemCommand.EXIT_OK;
        }

        List<Task> tasks;
        try {
            tasks = prepareTasks(definitions);
        } catch (IllegalArgumentException | IllegalStateException | GitCommandException e) {
            ConsoleOutput.error(e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }

        ExecutionEngine engine = maxConcurrent != null
                ? engineFactory.create(maxConcurrent)
                : engineFactory.create();
        EventBus.Subscription progress = eventBus.subscribe(
                tasks.stream().map(Task::id).toList(), "task.", ConsoleOutput::taskEvent);
        try {
            if (worktrees) {
                engine.onTaskComplete(result -> finishExecution(result.taskId(), ExecutionStatus.COMPLETED));
                engine.onTaskFailed((taskId, error) -> finishExecution(taskId, ExecutionStatus.FAILED));
            }

            ConsoleOutput.info("Running " + tasks.size() + " task" + (tasks.size() != 1 ? "s" : ""));
            List<String> ids = engine.submitTasks(tasks);

            var settled = new ArrayList<CompletableFuture<?>>();
            for (String id : ids) {
                settled.add(engine.waitForTask(id).handle((result, error) -> null));
            }
            CompletableFuture.allOf(settled.toArray(CompletableFuture[]::new)).join();
            progress.unsubscribe();

            boolean allCompleted = true;
            System.out.println();
            for (String id : ids) {
                TaskStatus status = engine.getTaskStatus(id);
                var result = status.result();
                ConsoleOutput.taskStatus(id, status.state(), status.attempt(),
                        result != null && !result.success() ? result.error() : null);
                allCompleted &= result != null && result.success();
            }
            ConsoleOutput.metrics(engine.getMetrics());
            return allCompleted ? TandemCommand.EXIT_OK : TandemCommand.EXIT_CONFLICT;
        } finally {
            progress.unsubscribe();
            engine.shutdown();
        }
    }

    private List<Task> prepareTasks(List<TaskDefinition> definitions) {
        String defaultWorkDir = Path.of(properties.getRepoPath()).toAbsolutePath().normalize().toString();
        var tasks = new ArrayList<Task>();
        for (TaskDefinition definition : definitions) {
            Task task = definition.toTask(defaultWorkDir);
            if (worktrees) {
                var worktree = worktreeManager.createWorktree(task.id(), targetBranch);
                if (!worktree.success()) {
                    throw new IllegalStateException(worktree.error());
                }
                records.save(new ExecutionRecord(task.id(), task.id(), ExecutionStatus.RUNNING,
                        worktree.worktreePath().toString(), worktree.branchName(), targetBranch, null, null));
                task = new Task(task.id(), task.type(), task.prompt(), worktree.worktreePath().toString(),
                        task.priority(), task.dependencies(), task.config(), task.createdAt());
            }
            tasks.add(task);
        }
        return tasks;
    }

    private void finishExecution(String taskId, ExecutionStatus status) {
        records.find(taskId).ifPresent(record -> {
            if (status == ExecutionStatus.COMPLETED) {
                try {
                    worktreeManager.commitAll(Path.of(record.worktreePath()), "Task " + taskId);
                } catch (GitCommandException e) {
                    log.warn("Could not commit worktree of {}: {}", taskId, e.getMessage());
                }
            }
            records.save(record.withStatus(status));
        });
    }
}
