package com.tandem.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Creates and removes the isolated checkout each execution works in.
 *
 * <p>Each execution gets branch {@code <branchPrefix><executionId>} checked out
 * at {@code <root>/<executionId>}, branching from the target branch. Removing
 * the worktree keeps the branch so it can still be synced.
 */
public class WorktreeManager {

    private static final Logger log = LoggerFactory.getLogger(WorktreeManager.class);

    private final GitCli git;
    private final Path repoPath;
    private final Path worktreeRoot;
    private final String branchPrefix;

    /** Maps executionId to its worktree path. */
    private final ConcurrentHashMap<String, Path> worktrees = new ConcurrentHashMap<>();

    public WorktreeManager(GitCli git, Path repoPath, Path worktreeRoot, String branchPrefix) {
        this.git = git;
        this.repoPath = repoPath;
        this.worktreeRoot = worktreeRoot.isAbsolute() ? worktreeRoot : repoPath.resolve(worktreeRoot);
        this.branchPrefix = branchPrefix;
    }

    /**
     * Result of a worktree operation.
     */
    public record WorktreeResult(boolean success, Path worktreePath, String branchName, String error) {
        public static WorktreeResult success(Path path, String branchName) {
            return new WorktreeResult(true, path, branchName, null);
        }
        public static WorktreeResult failure(String error) {
            return new WorktreeResult(false, null, null, error);
        }
    }

    public String getBranchName(String executionId) {
        return branchPrefix + executionId;
    }

    public Path getWorktreePath(String executionId) {
        return worktreeRoot.resolve(executionId);
    }

    /**
     * Creates an isolated worktree for an execution. Idempotent: an existing
     * worktree is reused and an existing branch (from an earlier attempt) is
     * checked out instead of recreated.
     */
    public WorktreeResult createWorktree(String executionId, String targetBranch) {
        String branchName = getBranchName(executionId);
        Path worktreePath = getWorktreePath(executionId);

        Path existing = worktrees.get(executionId);
        if (existing != null && Files.isDirectory(existing)) {
            log.info("Reusing existing worktree for {} at {}", executionId, existing);
            return WorktreeResult.success(existing, branchName);
        }

        try {
            Files.createDirectories(worktreeRoot);
        } catch (IOException e) {
            return WorktreeResult.failure("Cannot create worktree root " + worktreeRoot + ": " + e.getMessage());
        }

        log.info("Adding worktree for {} at {} (branch: {})", executionId, worktreePath, branchName);
        GitResult result = git.run(repoPath, "worktree", "add", "-b", branchName,
                worktreePath.toString(), targetBranch);
        if (!result.ok()) {
            log.info("Branch {} may already exist, trying to check out existing branch", branchName);
            result = git.run(repoPath, "worktree", "add", worktreePath.toString(), branchName);
            if (!result.ok()) {
                String error = "Failed to create worktree for %s (exit code %d): %s"
                        .formatted(executionId, result.exitCode(), result.stderr().strip());
                log.error(error);
                return WorktreeResult.failure(error);
            }
        }

        worktrees.put(executionId, worktreePath);
        log.info("Worktree created for {} at {}", executionId, worktreePath);
        return WorktreeResult.success(worktreePath, branchName);
    }

    /**
     * Removes an execution's worktree. The branch is preserved for sync.
     *
     * @return true if removal succeeded or there was nothing to remove
     */
    public boolean removeWorktree(String executionId) {
        Path worktreePath = worktrees.remove(executionId);
        if (worktreePath == null) {
            worktreePath = getWorktreePath(executionId);
        }
        if (!Files.exists(worktreePath)) {
            log.debug("No worktree to remove for {}", executionId);
            git.runGit(repoPath, "worktree", "prune");
            return true;
        }

        log.info("Removing worktree for {} at {}", executionId, worktreePath);
        int exitCode = git.runGit(repoPath, "worktree", "remove", "--force", worktreePath.toString());
        if (exitCode != 0) {
            log.warn("git worktree remove failed for {}, attempting manual cleanup", executionId);
            deleteDirectory(worktreePath);
            git.runGit(repoPath, "worktree", "prune");
        }
        return !Files.exists(worktreePath);
    }

    /**
     * Stages and commits everything in a worktree.
     *
     * @return true if a commit was made, false if there was nothing to commit
     * @throws GitCommandException if staging or committing fails
     */
    public boolean commitAll(Path worktreePath, String message) {
        git.runChecked(worktreePath, "add", "-A");
        String status = git.runGitOutput(worktreePath, "status", "--porcelain");
        if (status.isEmpty()) {
            log.info("No changes to commit in {}", worktreePath);
            return false;
        }
        git.runChecked(worktreePath, "commit", "-m", message);
        log.info("Committed changes in {}", worktreePath);
        return true;
    }

    /**
     * @return worktrees created by this manager, keyed by execution id
     */
    public Map<String, Path> getActiveWorktrees() {
        return Map.copyOf(worktrees);
    }

    private static void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not delete directory {}: {}", dir, e.getMessage());
        }
    }
}
