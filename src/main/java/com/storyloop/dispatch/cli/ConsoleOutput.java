package com.storyloop.dispatch.cli;

import com.storyloop.core.health.WorkerHealth;
import com.storyloop.core.model.RunReport;
import com.storyloop.core.model.TaskOutcome;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the storyloop CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STORYLOOP v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STORYLOOP]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void worker(WorkerHealth health) {
        String color = switch (health.status()) {
            case HEALTHY -> "fg(green)";
            case HUNG -> "fg(yellow)";
            case DEAD -> "fg(red)";
            case UNKNOWN -> "fg(white)";
        };
        String task = health.taskId() != null ? " task " + health.taskId() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + health.status() + "|@ " + health.workerId() + task
                + " (" + health.reason() + ")"));
    }

    public static void outcome(TaskOutcome outcome) {
        String color = switch (outcome.status()) {
            case MERGED -> "fg(green)";
            case MERGE_CONFLICT -> "fg(yellow)";
            case FAILED -> "fg(red)";
            case SKIPPED_DEPENDENCY_FAILED -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|" + color + " " + outcome.status() + "|@ " + outcome.taskId()
                + " after " + outcome.attempts() + " attempt(s): " + outcome.detail()));
    }

    public static void report(RunReport report) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Run " + report.runId() + "|@"));
        report.outcomes().values().forEach(ConsoleOutput::outcome);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Merged: @|fg(green) " + report.mergedIds().size() + "|@ of " + report.outcomes().size()
                + " in " + formatDuration(report.elapsed().toMillis())));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
