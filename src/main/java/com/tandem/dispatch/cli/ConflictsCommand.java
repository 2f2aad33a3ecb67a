package com.tandem.dispatch.cli;

import com.tandem.worktree.ConflictDetector;
import com.tandem.worktree.ConflictReport;
import com.tandem.worktree.GitCommandException;
import com.tandem.merge.MergeToolException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: tandem conflicts &lt;branchA&gt; &lt;branchB&gt;
 */
@Command(name = "conflicts", mixinStandardHelpOptions = true,
        description = "Report files that would conflict when merging two branches")
@Component
public class ConflictsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "First branch")
    private String branchA;

    @Parameters(index = "1", description = "Second branch")
    private String branchB;

    private final ConflictDetector conflictDetector;

    public ConflictsCommand(ConflictDetector conflictDetector) {
        this.conflictDetector = conflictDetector;
    }

    @Override
    public Integer call() {
        ConflictReport report;
        try {
            report = conflictDetector.detectConflicts(branchA, branchB);
        } catch (GitCommandException | MergeToolException e) {
            ConsoleOutput.error("Conflict check failed: " + e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }
        ConsoleOutput.conflictReport(report);
        return report.hasConflicts() ? TandemCommand.EXIT_CONFLICT : TandemCommand.EXIT_OK;
    }
}
