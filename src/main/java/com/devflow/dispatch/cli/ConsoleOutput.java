package com.devflow.dispatch.cli;

import com.devflow.core.batch.OutputValidation;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.ProcessResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the devflow CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DEVFLOW v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DEVFLOW]|@ " + message));
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

    /** Raw process output, passed through unchanged. */
    public static void stream(String chunk) {
        System.out.print(chunk);
        System.out.flush();
    }

    public static void streamError(String chunk) {
        System.err.print(chunk);
        System.err.flush();
    }

    public static void result(CommandResult r) {
        String status = switch (r.status()) {
            case COMPLETED -> "@|fg(green),bold COMPLETED|@";
            case CANCELLED -> "@|fg(yellow),bold CANCELLED|@";
            default -> "@|fg(red),bold " + r.status() + "|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                status + " " + r.id() + " in " + formatDuration(r.duration())
                        + (r.exitCode() != null ? " (exit " + r.exitCode() + ")" : "")));
        if (r.error() != null && !r.success()) {
            error(r.error().strip());
        }
    }

    public static void processResult(ProcessResult r) {
        if (r.success()) {
            success("Exited 0 in " + formatDuration(r.duration()));
        } else {
            error(r.reason() + ", exit " + r.exitCode() + " after " + formatDuration(r.duration())
                    + (r.error() == null || r.error().isBlank() ? "" : ": " + r.error().strip()));
        }
    }

    public static void validation(OutputValidation v) {
        v.valid().forEach(t -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(green) VALID|@   " + t.id())));
        v.missing().forEach(t -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) MISSING|@ " + t.id())));
        v.corrupt().forEach(t -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) CORRUPT|@ " + t.id())));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
