package com.scanfleet.dispatch.cli;

import com.scanfleet.core.model.StatsSnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the scanfleet CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SCANFLEET v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SCANFLEET]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void summary(StatsSnapshot stats) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold === Summary ===|@"));
        System.out.println("Projects created: " + stats.created());
        System.out.println("Projects already existed: " + stats.existing());
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "Repos scanned successfully: @|fg(green) " + stats.scanned() + "|@"));
        System.out.println("Config-only scans: " + stats.configOnly());
        System.out.println("Empty repos: " + stats.empty());
        String failures = stats.failed() > 0
                ? "@|fg(red) " + stats.failed() + "|@"
                : String.valueOf(stats.failed());
        System.out.println(CommandLine.Help.Ansi.AUTO.string("Failures: " + failures));
    }
}
