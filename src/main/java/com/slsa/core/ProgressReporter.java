package com.slsa.core;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Console progress indicator for long runs.
 * Each call to {@link #step(String)} counts one unit of work under a label;
 * every 100 units the running count is redrawn on the same line, and when the
 * label changes the previous phase is closed with a "done" line.
 */
public final class ProgressReporter {
    /** Reporter that never writes anything. */
    public static final ProgressReporter DISABLED = new ProgressReporter(null);

    private static final int REDRAW_EVERY = 100;

    private final PrintStream out;
    private String label;
    private long count;

    /**
     * @param out destination, usually stderr; {@code null} disables reporting
     */
    public ProgressReporter(PrintStream out) {
        this.out = out;
    }

    public boolean isEnabled() {
        return out != null;
    }

    /**
     * Count one step of the phase named {@code phase}.
     */
    public void step(String phase) {
        Objects.requireNonNull(phase, "phase");
        if (out == null) return;
        if (label == null) {
            label = phase;
        }
        if (!label.equals(phase)) {
            closePhase();
            label = phase;
        }
        if (++count % REDRAW_EVERY == 0) {
            out.print("\r" + label + ": " + count);
            out.flush();
        }
    }

    /**
     * Close the current phase, if any. Called once at the end of a run.
     */
    public void finish() {
        if (out == null || label == null) return;
        closePhase();
        label = null;
    }

    private void closePhase() {
        out.println("\r" + label + ": " + count + " - done");
        count = 0;
    }
}
