package com.tandem.worktree;

import com.tandem.merge.LineMerger;
import com.tandem.merge.MergeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the files that would conflict when merging two branches.
 *
 * <p>Only files changed on both sides relative to the merge base are
 * candidates. Each candidate is trial-merged with {@link LineMerger}; files
 * changed identically, or whose edits land on disjoint lines, are not
 * reported. Binary files changed differently on both sides are code
 * conflicts without a trial merge. Structured logs are classified by
 * {@link StructuredLogMatcher}; everything else is a code conflict. Read-only:
 * no ref or working tree is touched.
 */
public class ConflictDetector {

    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private static final int BINARY_SNIFF_LENGTH = 8000;

    private final GitCli git;
    private final LineMerger lineMerger;
    private final StructuredLogMatcher matcher;
    private final Path repoPath;

    public ConflictDetector(GitCli git, LineMerger lineMerger, StructuredLogMatcher matcher, Path repoPath) {
        this.git = git;
        this.lineMerger = lineMerger;
        this.matcher = matcher;
        this.repoPath = repoPath;
    }

    /**
     * @throws GitCommandException if either ref is unknown or the branches share no history
     */
    public ConflictReport detectConflicts(String branchA, String branchB) {
        String mergeBase = git.runGitOutput(repoPath, "merge-base", branchA, branchB);
        return detectConflicts(mergeBase, branchA, branchB);
    }

    /**
     * Variant for callers that already resolved the merge base.
     */
    public ConflictReport detectConflicts(String mergeBase, String branchA, String branchB) {
        Set<String> changedA = changedFiles(mergeBase, branchA);
        Set<String> changedB = changedFiles(mergeBase, branchB);
        changedA.retainAll(changedB);
        log.debug("{} file(s) changed on both {} and {} since {}", changedA.size(), branchA, branchB, mergeBase);

        var jsonlConflicts = new ArrayList<JsonlConflict>();
        var codeConflicts = new ArrayList<CodeConflict>();
        for (String path : changedA) {
            byte[] base = git.showBytes(repoPath, mergeBase, path);
            byte[] ours = git.showBytes(repoPath, branchA, path);
            byte[] theirs = git.showBytes(repoPath, branchB, path);

            if (ours == null && theirs == null) {
                continue;
            }
            if (ours == null || theirs == null) {
                if (base != null && !Arrays.equals(ours != null ? ours : theirs, base)) {
                    String deletedOn = ours == null ? branchA : branchB;
                    String modifiedOn = ours == null ? branchB : branchA;
                    codeConflicts.add(new CodeConflict(path, ConflictType.MODIFY_DELETE,
                            "File deleted on %s and modified on %s".formatted(deletedOn, modifiedOn),
                            "Decide whether to keep the modified file or accept the deletion"));
                }
                continue;
            }
            if (Arrays.equals(ours, theirs)) {
                continue;
            }
            if (isBinary(base) || isBinary(ours) || isBinary(theirs)) {
                codeConflicts.add(new CodeConflict(path, ConflictType.CONTENT,
                        "Binary file modified on both %s and %s".formatted(branchA, branchB),
                        "Pick one version of the file; binary content cannot be line-merged"));
                continue;
            }

            MergeResult trial = lineMerger.merge(text(base), text(ours), text(theirs));
            if (!trial.hasConflicts()) {
                continue;
            }

            Optional<String> entityType = matcher.entityType(path);
            if (entityType.isPresent()) {
                jsonlConflicts.add(new JsonlConflict(path, entityType.get()));
            } else {
                codeConflicts.add(new CodeConflict(path, ConflictType.CONTENT,
                        "File modified on both %s and %s (%d conflicting hunk%s)".formatted(
                                branchA, branchB, trial.conflictCount(), trial.conflictCount() == 1 ? "" : "s"),
                        "Merge manually: review both versions and keep the intended changes"));
            }
        }

        ConflictReport report = ConflictReport.of(jsonlConflicts, codeConflicts);
        log.info("Conflict check {} vs {}: {}", branchA, branchB, report.summary());
        return report;
    }

    /** Same heuristic as git: a NUL byte in the first 8000 bytes. */
    static boolean isBinary(byte[] content) {
        if (content == null) {
            return false;
        }
        int limit = Math.min(content.length, BINARY_SNIFF_LENGTH);
        for (int i = 0; i < limit; i++) {
            if (content[i] == 0) {
                return true;
            }
        }
        return false;
    }

    private static String text(byte[] content) {
        return content == null ? "" : new String(content, StandardCharsets.UTF_8);
    }

    private Set<String> changedFiles(String from, String to) {
        List<String> lines = git.runGitLines(repoPath, "diff", "--name-only", "--no-renames", from, to);
        return new LinkedHashSet<>(lines);
    }
}
