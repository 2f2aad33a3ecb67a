package com.tandem.worktree;

/**
 * How a code file conflicts between two branches.
 */
public enum ConflictType {
    /** Both sides edited overlapping lines. */
    CONTENT,
    /** One side deleted the file, the other modified it. */
    MODIFY_DELETE
}
