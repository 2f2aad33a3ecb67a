package com.tandem.worktree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Thin wrapper around the {@code git} executable.
 *
 * <p>Arguments are always passed to {@link ProcessBuilder} as a discrete vector,
 * never through a shell. This class shells out to the git CLI rather than
 * depending on JGit so behaviour matches what users see in their terminal.
 */
public class GitCli {

    private static final Logger log = LoggerFactory.getLogger(GitCli.class);

    private final String executable;

    public GitCli(String executable) {
        this.executable = executable;
    }

    public String getExecutable() {
        return executable;
    }

    /**
     * Runs a git command and captures stdout and stderr.
     *
     * @param workDir working directory for the git command
     * @param args    git arguments (e.g. "merge-base", "main", "feature")
     * @return the captured result; non-zero exits are returned, not thrown
     * @throws GitCommandException if the executable cannot be started
     */
    public GitResult run(Path workDir, String... args) {
        RawResult raw = execute(workDir, args);
        return new GitResult(raw.exitCode(), new String(raw.stdout(), StandardCharsets.UTF_8), raw.stderr());
    }

    /**
     * Runs a git command and returns the exit code.
     */
    public int runGit(Path workDir, String... args) {
        GitResult result = run(workDir, args);
        if (!result.ok()) {
            log.debug("git exited with {}: {}", result.exitCode(), result.stderr().strip());
        }
        return result.exitCode();
    }

    /**
     * Runs a git command and returns its trimmed stdout.
     *
     * @throws GitCommandException if git exits non-zero
     */
    public String runGitOutput(Path workDir, String... args) {
        GitResult result = run(workDir, args);
        if (!result.ok()) {
            log.warn("Git command exited with code {}: {}", result.exitCode(), buildCommand(args));
            throw new GitCommandException(buildCommand(args), result.exitCode(), result.stderr(), null);
        }
        return result.stdout().strip();
    }

    /**
     * Runs a git command that must succeed, discarding its output.
     *
     * @throws GitCommandException if git exits non-zero
     */
    public void runChecked(Path workDir, String... args) {
        GitResult result = run(workDir, args);
        if (!result.ok()) {
            throw new GitCommandException(buildCommand(args), result.exitCode(), result.stderr(), null);
        }
    }

    /**
     * Splits command output into non-blank lines.
     */
    public List<String> runGitLines(Path workDir, String... args) {
        String output = runGitOutput(workDir, args);
        if (output.isEmpty()) {
            return List.of();
        }
        return output.lines().filter(line -> !line.isBlank()).toList();
    }

    /**
     * Resolves a revision to a commit sha, or returns null if it does not exist.
     */
    public String resolveCommit(Path workDir, String rev) {
        GitResult result = run(workDir, "rev-parse", "--verify", "--quiet", rev + "^{commit}");
        return result.ok() ? result.stdout().strip() : null;
    }

    /**
     * Reads a file at a revision, or returns null if the path does not exist there.
     */
    public String show(Path workDir, String rev, String path) {
        GitResult result = run(workDir, "show", rev + ":" + path);
        return result.ok() ? result.stdout() : null;
    }

    /**
     * Reads a file at a revision as raw bytes, or returns null if the path does not exist there.
     */
    public byte[] showBytes(Path workDir, String rev, String path) {
        RawResult raw = execute(workDir, "show", rev + ":" + path);
        return raw.exitCode() == 0 ? raw.stdout() : null;
    }

    private RawResult execute(Path workDir, String... args) {
        var command = buildCommand(args);
        log.debug("Running: {}", command);

        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .start();
            process.getOutputStream().close();

            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(
                    () -> new String(readAll(process.getErrorStream()), StandardCharsets.UTF_8));
            byte[] stdout = readAll(process.getInputStream());
            int exitCode = process.waitFor();
            return new RawResult(exitCode, stdout, stderr.join());
        } catch (IOException e) {
            throw new GitCommandException(command, -1, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitCommandException(command, -1, "interrupted", e);
        }
    }

    private record RawResult(int exitCode, byte[] stdout, String stderr) {}

    private List<String> buildCommand(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add(executable);
        command.addAll(List.of(args));
        return command;
    }

    private static byte[] readAll(InputStream stream) {
        try (stream) {
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
