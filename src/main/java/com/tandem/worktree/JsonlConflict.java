package com.tandem.worktree;

/**
 * A conflicting structured-log file. Always auto-resolvable.
 *
 * @param filePath   repository-relative path
 * @param entityType entity type inferred from the file name (e.g. "issue", "spec")
 */
public record JsonlConflict(String filePath, String entityType) {

    public boolean canAutoResolve() {
        return true;
    }
}
