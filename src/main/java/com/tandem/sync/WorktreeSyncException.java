package com.tandem.sync;

/**
 * A sync precondition does not hold. Nothing was changed.
 */
public class WorktreeSyncException extends RuntimeException {

    private final SyncErrorCode code;

    public WorktreeSyncException(String message, SyncErrorCode code) {
        this(message, code, null);
    }

    public WorktreeSyncException(String message, SyncErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public SyncErrorCode getCode() {
        return code;
    }
}
