package com.tandem.worktree;

import java.util.List;

/**
 * A git command could not be run or exited with an unexpected status.
 */
public class GitCommandException extends RuntimeException {

    private final List<String> command;
    private final int exitCode;
    private final String stderr;

    public GitCommandException(List<String> command, int exitCode, String stderr, Throwable cause) {
        super("git command failed (exit %d): %s%s".formatted(exitCode, String.join(" ", command),
                stderr == null || stderr.isBlank() ? "" : ": " + stderr.strip()), cause);
        this.command = List.copyOf(command);
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public List<String> getCommand() {
        return command;
    }

    /** Exit status, or -1 if the executable could not be started. */
    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
