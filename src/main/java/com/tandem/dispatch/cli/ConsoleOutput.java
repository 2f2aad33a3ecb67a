package com.tandem.dispatch.cli;

import com.tandem.core.events.TandemEvent;
import com.tandem.core.model.EngineMetrics;
import com.tandem.core.model.TaskState;
import com.tandem.worktree.CodeConflict;
import com.tandem.worktree.ConflictReport;
import com.tandem.worktree.JsonlConflict;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Tandem CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TANDEM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TANDEM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void taskStatus(String taskId, TaskState state, int attempts, String detail) {
        String color = switch (state) {
            case COMPLETED -> "fg(green)";
            case FAILED -> "fg(red)";
            case CANCELLED -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + String.format("%-10s", state) + "|@ " + taskId
                        + " (" + attempts + " attempt" + (attempts != 1 ? "s" : "") + ")"
                        + (detail == null || detail.isBlank() ? "" : ": " + detail)));
    }

    /**
     * One progress line for a live task event; other event types are ignored.
     */
    public static void taskEvent(TandemEvent event) {
        Object attempt = event.payload().get("attempt");
        Object error = event.payload().get("error");
        switch (event.eventType()) {
            case "task.started" -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(cyan) >|@ " + event.subjectId() + " started (attempt " + attempt + ")"));
            case "task.retrying" -> warn(event.subjectId() + " retrying after attempt " + attempt
                    + (error == null ? "" : ": " + error));
            case "task.failed" -> error(event.subjectId() + " failed after "
                    + event.payload().get("attempts") + " attempt(s)" + (error == null ? "" : ": " + error));
            default -> {
            }
        }
    }

    public static void conflictReport(ConflictReport report) {
        if (!report.hasConflicts()) {
            success(report.summary());
            return;
        }
        warn(report.summary());
        for (JsonlConflict c : report.jsonlConflicts()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(green) auto|@   " + c.filePath() + " [" + c.entityType() + "]"));
        }
        for (CodeConflict c : report.codeConflicts()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) manual|@ " + c.filePath() + " [" + c.conflictType() + "] " + c.description()));
            System.out.println("         " + c.resolutionStrategy());
        }
    }

    public static void metrics(EngineMetrics m) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Engine Metrics|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + m.completedTasks() + " completed|@, @|fg(red) "
                        + m.failedTasks() + " failed|@, " + m.queuedTasks() + " queued"));
        System.out.printf("  Success rate: %.0f%%, avg duration: %s, throughput: %.2f/s%n",
                m.successRate() * 100, formatDuration((long) m.averageDurationMs()), m.throughput());
        System.out.println("  Processes spawned: " + m.totalProcessesSpawned());
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
