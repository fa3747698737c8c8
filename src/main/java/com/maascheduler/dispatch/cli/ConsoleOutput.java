package com.maascheduler.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the MAA Scheduler CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) MAA SCHEDULER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MAA]|@ " + message));
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

    public static void status(String label, String status) {
        String color = switch (status == null ? "" : status.toLowerCase()) {
            case "running" -> "fg(blue)";
            case "completed", "up" -> "fg(green)";
            case "failed", "down" -> "fg(red)";
            case "cancelled", "queued", "degraded" -> "fg(yellow)";
            default -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + label + " @|" + color + " " + status + "|@"));
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "scheduler.started", "scheduler.stopped", "scheduler.mode" -> "@|bold,fg(yellow) [SCHEDULER]|@";
            case "task.status" -> "@|fg(blue) [TASK]|@";
            case "task.history" -> "@|fg(green) [RUN]|@";
            case "task.list" -> "@|fg(cyan) [TASKS]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    public static void notRunning(String serverUrl) {
        error("Cannot connect to MAA Scheduler server at " + serverUrl);
        info("Start the server first: maa-scheduler serve");
    }

    static String formatDuration(double seconds) {
        long total = Math.round(seconds);
        if (total < 60) return total + "s";
        if (total < 3600) return (total / 60) + "m " + (total % 60) + "s";
        return (total / 3600) + "h " + (total % 3600 / 60) + "m";
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
