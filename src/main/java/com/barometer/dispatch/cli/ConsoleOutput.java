package com.barometer.dispatch.cli;

import picocli.CommandLine;

import java.io.PrintStream;

/**
 * ANSI-colored terminal output for the interactive commands. Agent commands
 * never use it: their stdout carries the status protocol.
 */
public class ConsoleOutput {

    static final String RULE = "──────────────────────────────────";

    private final PrintStream out;
    private final CommandLine.Help.Ansi ansi;

    public ConsoleOutput(PrintStream out, CommandLine.Help.Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    public static ConsoleOutput stdout() {
        return new ConsoleOutput(System.out, CommandLine.Help.Ansi.AUTO);
    }

    public void banner() {
        out.println(ansi.string("@|bold,fg(yellow) BAROMETER v0.1.0|@"));
        out.println(RULE);
    }

    public void rule() {
        out.println(RULE);
    }

    public void info(String message) {
        out.println(ansi.string("@|fg(cyan) ~|@ " + message));
    }

    public void success(String message) {
        out.println(ansi.string("@|fg(green) +|@ " + message));
    }

    public void error(String message) {
        out.println(ansi.string("@|fg(red) x|@ " + message));
    }
}
