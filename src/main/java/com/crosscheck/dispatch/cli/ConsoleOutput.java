package com.crosscheck.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Crosscheck CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CROSSCHECK v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CROSSCHECK]|@ " + message));
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

    /**
     * Prints a task state in the color of its outcome.
     */
    public static void state(String label, String state) {
        String color = switch (state) {
            case "COMPLETED" -> "green";
            case "FAILED" -> "red";
            case "ESCALATED" -> "yellow";
            default -> "cyan";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                label + " @|bold,fg(" + color + ") " + state + "|@"));
    }

    public static void attempt(int round, int attemptNumber, String result, String validator, String feedback) {
        String verdict = "PASS".equals(result) ? "@|fg(green) PASS|@" : "@|fg(red) FAIL|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [R" + round + " #" + attemptNumber + "]|@ " + verdict + " by " + validator
                        + (feedback != null && !feedback.isBlank() ? ": " + feedback : "")));
    }

    public static void escalation(String taskId, String reason, int rejections, String recommendation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) [ESCALATED]|@ " + taskId + " " + reason + " after " + rejections + " rejections"));
        if (recommendation != null && !recommendation.isBlank()) {
            System.out.println("    " + recommendation);
        }
    }

    public static void cannotConnect(int port) {
        error("Cannot connect to Crosscheck server at localhost:" + port);
        info("Start the server first: crosscheck serve");
    }
}
