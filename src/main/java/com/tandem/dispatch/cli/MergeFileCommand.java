package com.tandem.dispatch.cli;

import com.tandem.merge.LineMerger;
import com.tandem.merge.MergeResult;
import com.tandem.merge.MergeToolException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: tandem merge-file &lt;base&gt; &lt;ours&gt; &lt;theirs&gt; [-o out]
 */
@Command(name = "merge-file", mixinStandardHelpOptions = true,
        description = "Three-way merge of three text files")
@Component
public class MergeFileCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Common ancestor")
    private Path base;

    @Parameters(index = "1", description = "Our version")
    private Path ours;

    @Parameters(index = "2", description = "Their version")
    private Path theirs;

    @Option(names = {"--output", "-o"}, description = "Write the result here instead of stdout")
    private Path output;

    private final LineMerger lineMerger;

    public MergeFileCommand(LineMerger lineMerger) {
        this.lineMerger = lineMerger;
    }

    @Override
    public Integer call() {
        MergeResult result;
        try {
            result = lineMerger.merge(read(base), read(ours), read(theirs));
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read input: " + e.getMessage());
            return TandemCommand.EXIT_FATAL;
        } catch (MergeToolException e) {
            ConsoleOutput.error(e.getMessage());
            return TandemCommand.EXIT_FATAL;
        }

        if (output != null) {
            try {
                Files.writeString(output, result.content(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
                return TandemCommand.EXIT_FATAL;
            }
            if (result.hasConflicts()) {
                ConsoleOutput.warn(result.conflictCount() + " conflict(s) written to " + output);
            } else {
                ConsoleOutput.success("Merged cleanly into " + output);
            }
        } else {
            System.out.print(result.content());
        }
        return result.hasConflicts() ? TandemCommand.EXIT_CONFLICT : TandemCommand.EXIT_OK;
    }

    private static String read(Path file) throws IOException {
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
