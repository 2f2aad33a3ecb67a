package com.tandem.merge;

import com.tandem.core.metrics.TandemMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Three-way line merge backed by {@code git merge-file}.
 *
 * <p>Each call writes base, ours and theirs into a private scratch directory,
 * runs the merge with the ours file as output, reads it back and removes the
 * directory on every exit path. No repository is needed.
 *
 * <p>{@code git merge-file} exits with 0 for a clean merge and with the number
 * of conflicting hunks (capped at 127) otherwise. Any other status, or an
 * executable that cannot be started, raises {@link MergeToolException}.
 */
public class LineMerger {

    private static final Logger log = LoggerFactory.getLogger(LineMerger.class);

    static final int MAX_CONFLICT_EXIT = 127;

    private final String gitExecutable;
    private final TandemMetrics metrics;

    public LineMerger(String gitExecutable) {
        this(gitExecutable, null);
    }

    public LineMerger(String gitExecutable, TandemMetrics metrics) {
        this.gitExecutable = gitExecutable;
        this.metrics = metrics;
    }

    public MergeResult merge(String base, String ours, String theirs) {
        Path scratch;
        try {
            scratch = Files.createTempDirectory("tandem-merge-");
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create merge scratch directory", e);
        }
        try {
            Path baseFile = write(scratch, "base", base);
            Path oursFile = write(scratch, "ours", ours);
            Path theirsFile = write(scratch, "theirs", theirs);

            var command = List.of(gitExecutable, "merge-file",
                    "-L", "ours", "-L", "base", "-L", "theirs",
                    oursFile.toString(), baseFile.toString(), theirsFile.toString());
            log.debug("Running: {}", command);

            int exitCode;
            String stderr;
            try {
                Process process = new ProcessBuilder(command)
                        .directory(scratch.toFile())
                        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                        .start();
                CompletableFuture<String> err = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
                exitCode = process.waitFor();
                stderr = err.join();
            } catch (IOException e) {
                record("error");
                throw new MergeToolException("Merge tool '" + gitExecutable + "' could not be started", -1,
                        e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MergeToolException("Interrupted while waiting for merge tool", -1, "", e);
            }

            if (exitCode == 0) {
                record("clean");
                return MergeResult.clean(Files.readString(oursFile, StandardCharsets.UTF_8));
            }
            if (exitCode > 0 && exitCode <= MAX_CONFLICT_EXIT) {
                record("conflict");
                log.debug("Merge produced {} conflict(s)", exitCode);
                return MergeResult.conflicted(Files.readString(oursFile, StandardCharsets.UTF_8), exitCode);
            }
            record("error");
            log.warn("Merge tool exited with {}: {}", exitCode, stderr.strip());
            throw new MergeToolException("Merge tool failed with exit code " + exitCode, exitCode, stderr, null);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read or write merge scratch files", e);
        } finally {
            deleteDirectory(scratch);
        }
    }

    private static Path write(Path dir, String name, String content) throws IOException {
        return Files.writeString(dir.resolve(name), content == null ? "" : content, StandardCharsets.UTF_8);
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void record(String result) {
        if (metrics != null) {
            metrics.recordMerge(result);
        }
    }

    static void deleteDirectory(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Could not delete scratch file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Could not clean up scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
