package com.tandem.dispatch.cli;

import com.tandem.sync.CommitInfo;
import com.tandem.sync.SyncPreview;
import com.tandem.sync.WorktreeSyncException;
import com.tandem.sync.WorktreeSyncService;
import com.tandem.worktree.GitCommandException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tandem sync preview &lt;execution-id&gt;
 */
@Command(name = "preview", mixinStandardHelpOptions = true, description = "Show what a sync would do")
@Component
public class SyncPreviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Execution ID")
    private String executionId;

    private final WorktreeSyncService syncService;

    public SyncPreviewCommand(WorktreeSyncService syncService) {
        this.syncService = syncService;
    }

    @Override
    public Integer call() {
        SyncPreview preview;
        try {
            preview = syncService.previewSync(executionId);
        } catch (WorktreeSyncException e) {
            ConsoleOutput.error(e.getMessage() + " [" + e.getCode() + "]");
            return TandemCommand.EXIT_FATAL;
        } catch (GitCommandException e) {
            ConsoleOutput.error("Preview failed: " + e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }

        ConsoleOutput.info("Sync preview for " + executionId
                + (preview.executionStatus() != null ? " (" + preview.executionStatus() + ")" : ""));
        if (!preview.mergeBase().isEmpty()) {
            System.out.println("  Merge base: " + preview.mergeBase());
            System.out.println("  Commits: " + preview.commits().size());
            for (CommitInfo commit : preview.commits()) {
                System.out.printf("    %.8s %s (%s)%n", commit.sha(), commit.message(), commit.author());
            }
            System.out.printf("  Diff: %d file(s), +%d -%d%n",
                    preview.diff().files().size(), preview.diff().additions(), preview.diff().deletions());
            ConsoleOutput.conflictReport(preview.conflicts());
        }
        for (String warning : preview.warnings()) {
            ConsoleOutput.warn(warning);
        }
        if (preview.canSync()) {
            ConsoleOutput.success("Ready to sync");
            return TandemCommand.EXIT_OK;
        }
        ConsoleOutput.error("Cannot sync");
        return TandemCommand.EXIT_CONFLICT;
    }
}
