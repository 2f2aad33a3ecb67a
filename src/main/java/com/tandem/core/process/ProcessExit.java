package com.tandem.core.process;

/**
 * How a spawned process ended.
 *
 * @param exitCode process exit code (0 = success)
 * @param stdout   captured standard output
 * @param stderr   captured standard error
 */
public record ProcessExit(int exitCode, String stdout, String stderr) {

    public boolean success() {
        return exitCode == 0;
    }
}
