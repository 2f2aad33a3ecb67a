package com.tandem.merge;

/**
 * The merge tool failed outright (bad exit status or missing executable).
 * Distinct from a conflict, which is reported through {@link MergeResult}.
 */
public class MergeToolException extends RuntimeException {

    private final int exitCode;
    private final String stderr;

    public MergeToolException(String message, int exitCode, String stderr, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    /** Exit status of the tool, or -1 if it could not be run. */
    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
