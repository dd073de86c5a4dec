package io.partialtesting.cli;

import picocli.CommandLine;

import java.io.PrintWriter;

/**
 * ANSI-colored terminal output for the partial testing CLI. Results go to the command's
 * output stream, failures to its error stream; log records go to stderr through SLF4J.
 */
final class ConsoleOutput {

    private final PrintWriter out;
    private final PrintWriter err;

    ConsoleOutput(CommandLine commandLine) {
        this.out = commandLine.getOut();
        this.err = commandLine.getErr();
    }

    void info(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(cyan) [PARTIAL TESTING]|@ " + message));
        out.flush();
    }

    void success(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(green) +|@ " + message));
        out.flush();
    }

    void item(String message) {
        out.println("  -> " + message);
        out.flush();
    }

    void warn(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|fg(yellow) !|@ " + message));
        out.flush();
    }

    void fullSuite(String message) {
        out.println(CommandLine.Help.Ansi.AUTO.string("@|bold,fg(yellow) " + message + "|@"));
        out.flush();
    }

    void error(String message) {
        err.println(CommandLine.Help.Ansi.AUTO.string("@|fg(red) x|@ " + message));
        err.flush();
    }
}
