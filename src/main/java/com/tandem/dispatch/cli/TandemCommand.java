package com.tandem.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Tandem.
 * Routes to subcommands: run, conflicts, sync, merge-file.
 */
@Command(
        name = "tandem",
        mixinStandardHelpOptions = true,
        version = "Tandem 0.1.0",
        description = "Runs coding-agent tasks in parallel worktrees and syncs their branches back",
        subcommands = {
                RunCommand.class,
                ConflictsCommand.class,
                SyncCommand.class,
                MergeFileCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TandemCommand implements Runnable {

    /** Everything went through. */
    public static final int EXIT_OK = 0;
    /** Conflicts found or tasks failed. */
    public static final int EXIT_CONFLICT = 1;
    /** The command itself could not do its job. */
    public static final int EXIT_FATAL = 2;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
