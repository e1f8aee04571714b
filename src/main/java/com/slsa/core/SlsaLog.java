package com.slsa.core;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Diagnostic logging for slsa.
 * Silent unless --verbose is given. Everything goes to stderr by default,
 * stdout is reserved for the tree dump.
 */
public final class SlsaLog {
    private static volatile boolean verbose = false;
    private static volatile PrintStream out = System.err;

    private SlsaLog() {
        // Utility class
    }

    public static void setVerbose(boolean enabled) {
        verbose = enabled;
    }

    public static boolean isVerbose() {
        return verbose;
    }

    /**
     * Redirect log output, mainly for tests. {@code null} restores stderr.
     */
    public static void setOutput(PrintStream stream) {
        out = stream == null ? System.err : stream;
    }

    public static void info(String fmt, Object... args) {
        log("INFO", fmt, args);
    }

    public static void debug(String fmt, Object... args) {
        log("DEBUG", fmt, args);
    }

    public static void warn(String fmt, Object... args) {
        log("WARN", fmt, args);
    }

    /**
     * Log an error with an optional cause; the stack trace is printed when present.
     */
    public static void error(String msg, Throwable t) {
        if (!verbose) return;
        PrintStream o = out;
        o.println("[ERROR] " + msg);
        if (t != null) {
            t.printStackTrace(o);
        }
    }

    private static void log(String level, String fmt, Object[] args) {
        if (!verbose) return;
        String msg = args.length == 0 ? fmt : String.format(Locale.ROOT, fmt, args);
        out.println("[" + level + "] " + msg);
    }
}
