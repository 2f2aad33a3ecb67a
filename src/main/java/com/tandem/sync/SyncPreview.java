package com.tandem.sync;

import com.tandem.worktree.ConflictReport;

import java.util.List;

/**
 * Dry-run assessment of a squash sync.
 *
 * @param canSync          true if {@code squashSync} is expected to land
 * @param warnings         reasons it cannot, and risks worth knowing about
 * @param conflicts        conflict report between execution and target branch
 * @param mergeBase        common ancestor, empty if unknown
 * @param commits          commits to be squashed, newest first
 * @param diff             changes the squash would bring in
 * @param uncommittedFiles files changed in the worktree but not committed (not synced)
 * @param executionStatus  status of the execution
 */
public record SyncPreview(
    boolean canSync,
    List<String> warnings,
    ConflictReport conflicts,
    String mergeBase,
    List<CommitInfo> commits,
    DiffSummary diff,
    List<String> uncommittedFiles,
    ExecutionStatus executionStatus
) {

    public SyncPreview {
        warnings = List.copyOf(warnings);
        commits = List.copyOf(commits);
        uncommittedFiles = List.copyOf(uncommittedFiles);
    }

    static SyncPreview blocked(String warning, ExecutionStatus status) {
        return new SyncPreview(false, List.of(warning), ConflictReport.none(), "", List.of(),
                DiffSummary.empty(), List.of(), status);
    }
}
