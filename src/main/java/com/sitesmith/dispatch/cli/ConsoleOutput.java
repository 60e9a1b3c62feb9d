package com.sitesmith.dispatch.cli;

import com.sitesmith.core.deploy.TeardownResult;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Sitesmith CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SITESMITH v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SITESMITH]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void version(int index, String versionId, boolean deployed) {
        String marker = deployed ? "@|fg(green),bold *|@" : " ";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + marker + " [" + index + "] " + versionId));
    }

    public static void teardown(TeardownResult result) {
        if (result.clean()) {
            success(result.message());
            return;
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) ! |@" + "Project deleted with cleanup failures:"));
        for (String failure : result.failures()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + failure));
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
