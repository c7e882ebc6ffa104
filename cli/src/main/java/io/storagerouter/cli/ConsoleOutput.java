package io.storagerouter.cli;

import java.io.PrintWriter;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output for the storage-router commands. Colors are
 * dropped automatically when the output is not a terminal.
 */
final class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    static void info(PrintWriter out, String message) {
        print(out, "@|fg(cyan) [router]|@ " + escape(message));
    }

    static void success(PrintWriter out, String message) {
        print(out, "@|fg(green) +|@ " + escape(message));
    }

    static void warn(PrintWriter out, String message) {
        print(out, "@|fg(yellow) !|@ " + escape(message));
    }

    static void error(PrintWriter out, String message) {
        print(out, "@|fg(red) x|@ " + escape(message));
    }

    /** Indented detail line under a previous message. */
    static void detail(PrintWriter out, String message) {
        out.println("    " + message);
        out.flush();
    }

    private static void print(PrintWriter out, String markup) {
        out.println(CommandLine.Help.Ansi.AUTO.string(markup));
        out.flush();
    }

    // user text may contain picocli markup delimiters
    private static String escape(String message) {
        return message == null ? "" : message.replace("@|", "@ |");
    }
}
