package com.tandem.sync;

import com.tandem.core.events.EventBus;
import com.tandem.core.events.TandemEvent;
import com.tandem.core.logging.MdcContext;
import com.tandem.core.metrics.TandemMetrics;
import com.tandem.merge.JsonlEntityResolver;
import com.tandem.merge.LineMerger;
import com.tandem.merge.MergeResult;
import com.tandem.merge.MergeToolException;
import com.tandem.worktree.ConflictDetector;
import com.tandem.worktree.ConflictReport;
import com.tandem.worktree.GitCli;
import com.tandem.worktree.GitCommandException;
import com.tandem.worktree.GitResult;
import com.tandem.worktree.StructuredLogMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Brings an execution's branch back into its target branch as one squash commit.
 *
 * <p>{@link #previewSync} is read-only. {@link #squashSync} runs in the main
 * checkout: it refuses to start on code conflicts, then tags the target
 * branch's current commit, squash-merges the execution branch, merges
 * conflicting structured logs automatically and commits. Any failure after
 * the tag exists resets the target branch to the tag. The tag is never
 * deleted.
 *
 * <p>Syncs of the same execution never interleave. Because every sync
 * mutates the one main checkout, syncs of different executions are also
 * serialized.
 */
public class WorktreeSyncService {

    private static final Logger log = LoggerFactory.getLogger(WorktreeSyncService.class);

    private static final char FIELD_SEPARATOR = '\u001f';

    private final GitCli git;
    private final ConflictDetector conflictDetector;
    private final LineMerger lineMerger;
    private final JsonlEntityResolver entityResolver;
    private final StructuredLogMatcher matcher;
    private final ExecutionRecordStore records;
    private final Path repoPath;
    private final String backupTagPrefix;
    private final EventBus eventBus;
    private final TandemMetrics metrics;

    /** Held only while a sync of that execution runs or waits; entries are dropped by the last holder. */
    private final Map<String, ExecutionLock> executionLocks = new ConcurrentHashMap<>();
    private final ReentrantLock checkoutLock = new ReentrantLock();

    public WorktreeSyncService(GitCli git, ConflictDetector conflictDetector, LineMerger lineMerger,
                               JsonlEntityResolver entityResolver, StructuredLogMatcher matcher,
                               ExecutionRecordStore records, Path repoPath, String backupTagPrefix,
                               EventBus eventBus, TandemMetrics metrics) {
        this.git = git;
        this.conflictDetector = conflictDetector;
        this.lineMerger = lineMerger;
        this.entityResolver = entityResolver;
        this.matcher = matcher;
        this.records = records;
        this.repoPath = repoPath;
        this.backupTagPrefix = backupTagPrefix;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public String getBackupTagPrefix() {
        return backupTagPrefix;
    }

    /**
     * Assesses a sync without changing anything.
     *
     * @throws WorktreeSyncException with EXECUTION_NOT_FOUND for an unknown id
     */
    public SyncPreview previewSync(String executionId) {
        ExecutionRecord execution = loadExecution(executionId);

        String blocked = checkCriticalPreconditions(execution);
        if (blocked != null) {
            log.info("Sync preview for {} blocked: {}", executionId, blocked);
            return SyncPreview.blocked(blocked, execution.status());
        }

        String branch = execution.branchName();
        String target = execution.targetBranch();
        String mergeBase = git.runGitOutput(repoPath, "merge-base", branch, target);
        List<CommitInfo> commits = listCommits(mergeBase, branch);
        DiffSummary diff = diffSummary(mergeBase, branch);
        ConflictReport conflicts = conflictDetector.detectConflicts(mergeBase, branch, target);
        List<String> uncommitted = uncommittedFiles(Path.of(execution.worktreePath()));

        var warnings = new ArrayList<String>();
        boolean canSync = true;
        if (isDirty()) {
            warnings.add("Local working tree has uncommitted changes. Stash or commit them first.");
            canSync = false;
        }
        if (execution.status() != null && execution.status().isActive()) {
            warnings.add("Execution is currently active. Synced state may not reflect the final result.");
        }
        if (conflicts.hasCodeConflicts()) {
            warnings.add("%d code conflict(s) detected. Manual resolution is required."
                    .formatted(conflicts.codeConflicts().size()));
            canSync = false;
        }
        if (commits.isEmpty()) {
            warnings.add("No commits to merge. Only committed changes are synced.");
            canSync = false;
        }
        if (!uncommitted.isEmpty()) {
            warnings.add("%d uncommitted file(s) in the worktree will not be included."
                    .formatted(uncommitted.size()));
        }

        return new SyncPreview(canSync, warnings, conflicts, mergeBase, commits, diff, uncommitted,
                execution.status());
    }

    public SyncResult squashSync(String executionId) {
        return squashSync(executionId, null);
    }

    /**
     * Squash-merges the execution branch into its target branch.
     *
     * @param customMessage commit message to use instead of the generated one, may be null
     * @return the outcome; conflicts and post-tag failures are reported here, not thrown
     * @throws WorktreeSyncException if a precondition does not hold
     */
    public SyncResult squashSync(String executionId, String customMessage) {
        ExecutionLock executionLock = acquireExecutionLock(executionId);
        checkoutLock.lock();
        MdcContext.setExecution(executionId);
        try {
            SyncResult result = doSquashSync(loadExecution(executionId), customMessage);
            recordOutcome(executionId, result);
            return result;
        } finally {
            MdcContext.clear();
            checkoutLock.unlock();
            releaseExecutionLock(executionId, executionLock);
        }
    }

    private ExecutionLock acquireExecutionLock(String executionId) {
        ExecutionLock entry = executionLocks.compute(executionId, (id, existing) -> {
            ExecutionLock lock = existing != null ? existing : new ExecutionLock();
            lock.holders++;
            return lock;
        });
        entry.lock.lock();
        return entry;
    }

    private void releaseExecutionLock(String executionId, ExecutionLock entry) {
        entry.lock.unlock();
        executionLocks.computeIfPresent(executionId, (id, existing) -> --existing.holders == 0 ? null : existing);
    }

    int executionLockCount() {
        return executionLocks.size();
    }

    /** holders is only touched inside the map's per-key compute. */
    private static final class ExecutionLock {
        final ReentrantLock lock = new ReentrantLock();
        int holders;
    }

    private SyncResult doSquashSync(ExecutionRecord execution, String customMessage) {
        validatePreconditions(execution);

        String branch = execution.branchName();
        String target = execution.targetBranch();
        String mergeBase = git.runGitOutput(repoPath, "merge-base", branch, target);

        List<CommitInfo> commits = listCommits(mergeBase, branch);
        if (commits.isEmpty()) {
            return SyncResult.failed(SyncErrorCode.NOTHING_TO_SYNC,
                    List.of("No commits to merge. Only committed changes are synced."));
        }
        if (git.runGit(repoPath, "merge-base", "--is-ancestor", branch, target) == 0) {
            return SyncResult.failed(SyncErrorCode.NOTHING_TO_SYNC,
                    List.of("Target branch is already up to date with the execution branch. Nothing to merge."));
        }

        ConflictReport conflicts = conflictDetector.detectConflicts(mergeBase, branch, target);
        if (conflicts.hasCodeConflicts()) {
            var warnings = new ArrayList<String>();
            warnings.add(conflicts.summary());
            conflicts.codeConflicts().forEach(c -> warnings.add(c.filePath() + ": " + c.description()));
            log.warn("Sync of {} refused: {}", execution.id(), conflicts.summary());
            return SyncResult.failed(SyncErrorCode.CODE_CONFLICTS, warnings);
        }

        String originalRef = currentBranch();
        String targetCommit = git.runGitOutput(repoPath, "rev-parse", target);
        String backupTag = createBackupTag(execution.id(), targetCommit);

        GitResult checkout = git.run(repoPath, "checkout", target);
        if (!checkout.ok()) {
            restoreBranch(originalRef, target);
            return SyncResult.failed(SyncErrorCode.MERGE_FAILED,
                    List.of("Could not check out " + target + ": " + checkout.stderr().strip()));
        }

        try {

            GitResult squash = git.run(repoPath, "merge", "--squash", branch);
            List<String> unmerged = git.runGitLines(repoPath, "diff", "--name-only", "--diff-filter=U");
            if (!squash.ok() && unmerged.isEmpty()) {
                return rollback(target, backupTag, originalRef, SyncErrorCode.MERGE_FAILED,
                        "git merge --squash failed: " + squash.stderr().strip());
            }

            var unresolved = new ArrayList<String>();
            int resolved = 0;
            for (String path : unmerged) {
                if (!matcher.matches(path)) {
                    unresolved.add(path);
                    continue;
                }
                resolveStructuredLog(path, mergeBase, targetCommit, branch);
                resolved++;
            }
            if (!unresolved.isEmpty()) {
                var warnings = new ArrayList<String>();
                warnings.add("Squash merge left %d unresolved code conflict(s)".formatted(unresolved.size()));
                warnings.addAll(unresolved);
                return rollback(target, backupTag, originalRef, SyncErrorCode.CODE_CONFLICTS, warnings);
            }

            List<String> staged = git.runGitLines(repoPath, "diff", "--cached", "--name-only");
            if (staged.isEmpty()) {
                return rollback(target, backupTag, originalRef, SyncErrorCode.NOTHING_TO_SYNC,
                        "Squash merge produced no changes");
            }

            String message = customMessage != null && !customMessage.isBlank()
                    ? customMessage
                    : commitMessage(execution, commits.size());
            git.runChecked(repoPath, "commit", "-m", message);
            String finalCommit = git.runGitOutput(repoPath, "rev-parse", "HEAD");

            records.save(execution.withAfterCommit(finalCommit));
            restoreBranch(originalRef, target);

            if (metrics != null && resolved > 0) {
                metrics.recordJsonlResolved(resolved);
            }
            var notes = new ArrayList<String>();
            if (resolved > 0) {
                notes.add("Auto-resolved %d structured log file(s)".formatted(resolved));
            }
            log.info("Synced {} into {} as {} ({} file(s), backup tag {})",
                    branch, target, finalCommit, staged.size(), backupTag);
            return SyncResult.succeeded(backupTag, finalCommit, staged.size(), resolved, notes);
        } catch (MergeToolException | GitCommandException | IllegalStateException e) {
            log.error("Sync of {} failed after backup tag {}: {}", execution.id(), backupTag, e.getMessage(), e);
            SyncErrorCode code = e instanceof MergeToolException || e instanceof IllegalStateException
                    ? SyncErrorCode.JSONL_RESOLUTION_FAILED
                    : SyncErrorCode.MERGE_FAILED;
            return rollback(target, backupTag, originalRef, code, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync of {} failed after backup tag {}: {}", execution.id(), backupTag, e.getMessage(), e);
            return rollback(target, backupTag, originalRef, SyncErrorCode.MERGE_FAILED, e.getMessage());
        }
    }

    /**
     * Line-merges one structured log from its three versions, falling back to
     * entity-level resolution when hunks still conflict, then stages it.
     */
    private void resolveStructuredLog(String path, String mergeBase, String ours, String theirs) {
        String base = orEmpty(git.show(repoPath, mergeBase, path));
        String oursContent = orEmpty(git.show(repoPath, ours, path));
        String theirsContent = orEmpty(git.show(repoPath, theirs, path));

        MergeResult merged = lineMerger.merge(base, oursContent, theirsContent);
        String content = merged.content();
        if (merged.hasConflicts()) {
            JsonlEntityResolver.Resolution resolution = entityResolver.resolve(merged.content());
            content = resolution.content();
            log.info("Resolved {} by entity merge ({} -> {} records)", path,
                    resolution.totalInput(), resolution.totalOutput());
        } else {
            log.info("Resolved {} by line merge", path);
        }

        try {
            Path file = repoPath.resolve(path);
            Files.createDirectories(file.getParent());
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Could not write resolved " + path, e);
        }
        git.runChecked(repoPath, "add", "--", path);
    }

    private SyncResult rollback(String target, String backupTag, String originalRef,
                                SyncErrorCode code, String warning) {
        return rollback(target, backupTag, originalRef, code, List.of(warning));
    }

    private SyncResult rollback(String target, String backupTag, String originalRef,
                                SyncErrorCode code, List<String> warnings) {
        var all = new ArrayList<>(warnings);
        GitResult reset = git.run(repoPath, "reset", "--hard", backupTag);
        if (reset.ok()) {
            log.warn("Rolled back {} to {}", target, backupTag);
            all.add("Rolled back %s to backup tag %s".formatted(target, backupTag));
        } else {
            log.error("Failed to roll back {} to {}: {}", target, backupTag, reset.stderr().strip());
            all.add("Rollback failed; recover manually with: git reset --hard " + backupTag);
        }
        restoreBranch(originalRef, target);
        return SyncResult.failed(code, all);
    }

    private String createBackupTag(String executionId, String targetCommit) {
        long suffix = System.currentTimeMillis();
        while (git.resolveCommit(repoPath, "refs/tags/" + backupTagPrefix + executionId + "-" + suffix) != null) {
            suffix++;
        }
        String tag = backupTagPrefix + executionId + "-" + suffix;
        git.runChecked(repoPath, "tag", "-a", tag, targetCommit,
                "-m", "Backup before syncing execution " + executionId);
        log.info("Created backup tag {} at {}", tag, targetCommit);
        return tag;
    }

    private void restoreBranch(String originalRef, String target) {
        if (originalRef != null && !originalRef.equals(target) && !"HEAD".equals(originalRef)) {
            if (git.runGit(repoPath, "checkout", originalRef) != 0) {
                log.warn("Could not switch back to {}", originalRef);
            }
        }
    }

    private String currentBranch() {
        GitResult result = git.run(repoPath, "rev-parse", "--abbrev-ref", "HEAD");
        return result.ok() ? result.stdout().strip() : null;
    }

    // --- Preconditions ---

    private ExecutionRecord loadExecution(String executionId) {
        return records.find(executionId).orElseThrow(() -> new WorktreeSyncException(
                "Execution " + executionId + " not found", SyncErrorCode.EXECUTION_NOT_FOUND));
    }

    /**
     * @return a warning if the sync cannot even be assessed, else null
     */
    private String checkCriticalPreconditions(ExecutionRecord execution) {
        try {
            checkRefs(execution);
            return null;
        } catch (WorktreeSyncException e) {
            return e.getMessage();
        }
    }

    private void validatePreconditions(ExecutionRecord execution) {
        checkRefs(execution);
        if (isDirty()) {
            throw new WorktreeSyncException(
                    "Local working tree has uncommitted changes. Stash or commit them first.",
                    SyncErrorCode.DIRTY_WORKING_TREE);
        }
    }

    private void checkRefs(ExecutionRecord execution) {
        if (execution.worktreePath() == null || execution.worktreePath().isBlank()) {
            throw new WorktreeSyncException("No worktree path for execution", SyncErrorCode.NO_WORKTREE);
        }
        if (!Files.isDirectory(Path.of(execution.worktreePath()))) {
            throw new WorktreeSyncException("Worktree no longer exists", SyncErrorCode.WORKTREE_MISSING);
        }
        if (!branchExists(execution.branchName())) {
            throw new WorktreeSyncException(
                    "Worktree branch '" + execution.branchName() + "' not found", SyncErrorCode.BRANCH_MISSING);
        }
        if (!branchExists(execution.targetBranch())) {
            throw new WorktreeSyncException(
                    "Target branch '" + execution.targetBranch() + "' not found", SyncErrorCode.TARGET_BRANCH_MISSING);
        }
        if (!git.run(repoPath, "merge-base", execution.branchName(), execution.targetBranch()).ok()) {
            throw new WorktreeSyncException(
                    "Worktree and target branch have diverged without common history", SyncErrorCode.NO_COMMON_BASE);
        }
    }

    private boolean branchExists(String branch) {
        return branch != null && !branch.isBlank() && git.resolveCommit(repoPath, "refs/heads/" + branch) != null;
    }

    /** Tracked changes only; untracked files do not block a squash. */
    private boolean isDirty() {
        return !git.runGitOutput(repoPath, "status", "--porcelain", "--untracked-files=no").isEmpty();
    }

    // --- Read-only queries ---

    List<CommitInfo> listCommits(String mergeBase, String branch) {
        String format = "--format=%H" + FIELD_SEPARATOR + "%an" + FIELD_SEPARATOR + "%ae"
                + FIELD_SEPARATOR + "%ct" + FIELD_SEPARATOR + "%s";
        var commits = new ArrayList<CommitInfo>();
        for (String line : git.runGitLines(repoPath, "log", format, mergeBase + ".." + branch)) {
            String[] fields = line.split(String.valueOf(FIELD_SEPARATOR), 5);
            if (fields.length < 5) {
                continue;
            }
            commits.add(new CommitInfo(fields[0], fields[1], fields[2],
                    Instant.ofEpochSecond(Long.parseLong(fields[3])), fields[4]));
        }
        return commits;
    }

    DiffSummary diffSummary(String from, String to) {
        var files = new ArrayList<String>();
        int additions = 0;
        int deletions = 0;
        for (String line : git.runGitLines(repoPath, "diff", "--numstat", "--no-renames", from, to)) {
            String[] fields = line.split("\t", 3);
            if (fields.length < 3) {
                continue;
            }
            files.add(fields[2]);
            if (!"-".equals(fields[0])) {
                additions += Integer.parseInt(fields[0]);
                deletions += Integer.parseInt(fields[1]);
            }
        }
        return new DiffSummary(files, additions, deletions);
    }

    private List<String> uncommittedFiles(Path worktree) {
        GitResult status = git.run(worktree, "status", "--porcelain");
        if (!status.ok()) {
            return List.of();
        }
        return status.stdout().lines()
                .filter(line -> line.length() > 3)
                .map(line -> line.substring(3))
                .toList();
    }

    static String commitMessage(ExecutionRecord execution, int commitCount) {
        String issueId = execution.issueId() != null ? execution.issueId() : "unknown";
        return """
                Squash merge from %s (%d commit%s)

                Issue: %s
                Execution: %s

                Synced changes from worktree execution.""".formatted(
                execution.branchName(), commitCount, commitCount == 1 ? "" : "s", issueId, execution.id());
    }

    private static String orEmpty(String content) {
        return content == null ? "" : content;
    }

    private void recordOutcome(String executionId, SyncResult result) {
        if (metrics != null) {
            metrics.recordSync(result.success());
        }
        if (eventBus != null) {
            eventBus.publish(TandemEvent.of(result.success() ? "sync.completed" : "sync.failed", executionId,
                    result.success()
                            ? Map.of("commit", result.finalCommit(), "backupTag", result.backupTag())
                            : Map.of("error", String.valueOf(result.errorCode()))));
        }
    }
}
