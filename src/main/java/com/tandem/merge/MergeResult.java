package com.tandem.merge;

/**
 * Outcome of a three-way line merge.
 *
 * @param success       true when the merge applied without conflicts
 * @param content       merged text; contains conflict markers when {@code hasConflicts}
 * @param hasConflicts  true when at least one hunk conflicted
 * @param conflictCount number of conflicting hunks reported by the merge tool
 */
public record MergeResult(boolean success, String content, boolean hasConflicts, int conflictCount) {

    public static MergeResult clean(String content) {
        return new MergeResult(true, content, false, 0);
    }

    public static MergeResult conflicted(String content, int conflictCount) {
        return new MergeResult(false, content, true, conflictCount);
    }
}
