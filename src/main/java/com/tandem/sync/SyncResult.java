package com.tandem.sync;

import java.util.List;

/**
 * Outcome of a squash sync.
 *
 * @param success           true if the squash commit landed on the target branch
 * @param backupTag         tag at the pre-sync target position; set only on success
 * @param finalCommit       the squash commit, set only on success
 * @param filesChanged      files in the squash commit
 * @param jsonlFilesResolved structured logs merged automatically
 * @param warnings          why the sync did not land, or notes about what happened
 * @param errorCode         set when {@code success} is false
 */
public record SyncResult(
    boolean success,
    String backupTag,
    String finalCommit,
    int filesChanged,
    int jsonlFilesResolved,
    List<String> warnings,
    SyncErrorCode errorCode
) {

    public SyncResult {
        warnings = List.copyOf(warnings);
    }

    static SyncResult succeeded(String backupTag, String finalCommit, int filesChanged,
                                int jsonlFilesResolved, List<String> warnings) {
        return new SyncResult(true, backupTag, finalCommit, filesChanged, jsonlFilesResolved, warnings, null);
    }

    static SyncResult failed(SyncErrorCode code, List<String> warnings) {
        return new SyncResult(false, null, null, 0, 0, warnings, code);
    }
}
