package com.tandem.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command group: tandem sync preview|squash &lt;execution-id&gt;
 */
@Command(name = "sync", mixinStandardHelpOptions = true,
        description = "Preview or apply a squash sync of an execution branch",
        subcommands = {SyncPreviewCommand.class, SyncSquashCommand.class})
@Component
public class SyncCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }
}
