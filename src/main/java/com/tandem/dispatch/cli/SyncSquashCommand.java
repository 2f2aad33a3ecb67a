package com.tandem.dispatch.cli;

import com.tandem.sync.SyncResult;
import com.tandem.sync.WorktreeSyncException;
import com.tandem.sync.WorktreeSyncService;
import com.tandem.worktree.GitCommandException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tandem sync squash &lt;execution-id&gt; [-m message]
 */
@Command(name = "squash", mixinStandardHelpOptions = true,
        description = "Squash an execution branch onto its target branch")
@Component
public class SyncSquashCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Execution ID")
    private String executionId;

    @Option(names = {"--message", "-m"}, description = "Commit message (default: generated)")
    private String message;

    private final WorktreeSyncService syncService;

    public SyncSquashCommand(WorktreeSyncService syncService) {
        this.syncService = syncService;
    }

    @Override
    public Integer call() {
        SyncResult result;
        try {
            result = syncService.squashSync(executionId, message);
        } catch (WorktreeSyncException e) {
            ConsoleOutput.error(e.getMessage() + " [" + e.getCode() + "]");
            return TandemCommand.EXIT_FATAL;
        } catch (GitCommandException e) {
            ConsoleOutput.error("Sync failed: " + e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }

        for (String warning : result.warnings()) {
            if (result.success()) {
                ConsoleOutput.info(warning);
            } else {
                ConsoleOutput.warn(warning);
            }
        }
        if (result.success()) {
            ConsoleOutput.success("Synced " + executionId + " as " + result.finalCommit()
                    + " (" + result.filesChanged() + " file" + (result.filesChanged() != 1 ? "s" : "") + ")");
            ConsoleOutput.info("Backup tag: " + result.backupTag());
            return TandemCommand.EXIT_OK;
        }
        ConsoleOutput.error("Sync did not land [" + result.errorCode() + "]");
        return TandemCommand.EXIT_CONFLICT;
    }
}
