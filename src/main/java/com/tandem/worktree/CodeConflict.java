package com.tandem.worktree;

/**
 * A conflicting file that needs manual resolution.
 *
 * @param filePath           repository-relative path
 * @param conflictType       content clash or modify/delete
 * @param description        what happened to the file on each side
 * @param resolutionStrategy advisory text for whoever resolves it
 */
public record CodeConflict(
    String filePath,
    ConflictType conflictType,
    String description,
    String resolutionStrategy
) {

    public boolean canAutoResolve() {
        return false;
    }
}
