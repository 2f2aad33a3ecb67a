package com.tandem.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A single unit of agent work submitted to the execution engine.
 *
 * @param id           unique identifier (e.g., "TASK-001")
 * @param type         category tag (e.g., "issue", "spec", "custom")
 * @param prompt       payload handed to the agent process on stdin
 * @param workDir      directory the agent process runs in (usually an isolated worktree)
 * @param priority     informational priority; dispatch order is submission order
 * @param dependencies IDs of tasks that must complete successfully first
 * @param config       per-task execution settings (retries, timeout, environment)
 * @param createdAt    when the task was created
 */
public record Task(
    String id,
    String type,
    String prompt,
    String workDir,
    int priority,
    Set<String> dependencies,
    TaskConfig config,
    Instant createdAt
) implements Serializable {

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        dependencies = dependencies == null
                ? Set.of()
                : java.util.Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        config = config == null ? TaskConfig.defaults() : config;
        createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    /**
     * Convenience factory for a task with default config and no dependencies.
     */
    public static Task of(String id, String prompt, String workDir) {
        return new Task(id, "custom", prompt, workDir, 0, Set.of(), TaskConfig.defaults(), null);
    }

    public Task withDependencies(Set<String> deps) {
        return new Task(id, type, prompt, workDir, priority, deps, config, createdAt);
    }

    public Task withConfig(TaskConfig newConfig) {
        return new Task(id, type, prompt, workDir, priority, dependencies, newConfig, createdAt);
    }
}
