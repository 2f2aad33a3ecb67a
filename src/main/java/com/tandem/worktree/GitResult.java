package com.tandem.worktree;

/**
 * Captured outcome of one git invocation.
 */
public record GitResult(int exitCode, String stdout, String stderr) {

    public boolean ok() {
        return exitCode == 0;
    }
}
