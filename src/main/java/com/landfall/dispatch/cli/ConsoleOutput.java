package com.landfall.dispatch.cli;

import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Landfall CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) LANDFALL v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [LANDFALL]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void resource(String kind, String name, String namespace) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) " + kind + "|@/" + name + " @|faint (" + namespace + ")|@"));
    }

    public static void classification(String kind, String strategy) {
        String color = "NO_CHECK".equals(strategy) ? "fg(white)" : "fg(green)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + kind + " @|" + color + " " + strategy + "|@"));
    }
}
