package com.dnagraph.dispatch.cli;

import picocli.CommandLine;

import java.util.List;

/**
 * ANSI-colored terminal output utilities for the dna-graph CLI.
 * Errors and warnings go to stderr; everything else to stdout.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DNA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) ERROR:|@ " + message));
    }

    public static void warning(String message) {
        System.err.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) WARNING:|@ " + message));
    }

    public static void heading(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + message + "|@"));
    }

    public static void line(String text) {
        System.out.println(text);
    }

    public static void lines(Iterable<String> text) {
        for (String line : text) {
            System.out.println(line);
        }
    }

    public static void rule() {
        System.out.println(RULE);
    }

    public static void findings(List<String> errors, List<String> warnings) {
        warnings.forEach(ConsoleOutput::warning);
        errors.forEach(ConsoleOutput::error);
    }
}
