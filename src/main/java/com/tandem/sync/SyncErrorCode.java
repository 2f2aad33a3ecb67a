package com.tandem.sync;

/**
 * Why a sync could not start or did not land.
 */
public enum SyncErrorCode {
    EXECUTION_NOT_FOUND,
    NO_WORKTREE,
    WORKTREE_MISSING,
    BRANCH_MISSING,
    TARGET_BRANCH_MISSING,
    DIRTY_WORKING_TREE,
    NO_COMMON_BASE,
    NOTHING_TO_SYNC,
    CODE_CONFLICTS,
    MERGE_FAILED,
    JSONL_RESOLUTION_FAILED
}
