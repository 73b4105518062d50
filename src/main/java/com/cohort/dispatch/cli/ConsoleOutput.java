package com.cohort.dispatch.cli;

import com.cohort.core.model.AgentTask;
import com.cohort.core.model.QueueStatus;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the Cohort CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) COHORT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [COHORT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void queue(String agentId, QueueStatus status) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold Queue|@ " + agentId + ": @|fg(yellow) " + status.pendingCount() + " pending|@, @|fg(blue) "
                        + status.inProgressCount() + " in progress|@"));
    }

    public static void taskTable(Iterable<AgentTask> tasks) {
        System.out.printf("  %-36s %-12s %-10s %-4s %s%n", "TASK", "STATUS", "SOURCE", "PRI", "DESCRIPTION");
        System.out.println("  " + "-".repeat(90));
        for (AgentTask t : tasks) {
            String color = switch (t.status()) {
                case COMPLETED -> "fg(green)";
                case FAILED -> "fg(red)";
                case IN_PROGRESS -> "fg(blue)";
                case PENDING -> "fg(yellow)";
            };
            System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                    "  %-36s @|" + color + " %-12s|@ %-10s %-4d %s",
                    t.id(), t.status(), t.source(), t.priority(), truncate(t.description(), 40))));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String oneLine = s.replace('\n', ' ');
        return oneLine.length() <= max ? oneLine : oneLine.substring(0, max - 3) + "...";
    }
}
