package com.trellis.dispatch.cli;

import com.trellis.core.model.CheckpointPhase;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Trellis CLI.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) TRELLIS v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TRELLIS]|@ " + message));
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
     * Phase label colored by outcome: failures red, successes green, the rest plain.
     */
    public static String phase(CheckpointPhase phase) {
        String color = switch (phase) {
            case EXECUTION_FAILURE, EXECUTION_FAILED -> "fg(red)";
            case POST_EXECUTION -> "fg(green)";
            case THREAD_CLOSED -> "fg(magenta)";
            case PRE_EXECUTION, MANUAL -> "fg(white)";
        };
        return CommandLine.Help.Ansi.AUTO.string("@|" + color + " " + phase.tag() + "|@");
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
