package com.cah.debug;

import java.io.PrintStream;

/**
 * Writes debug records as {@code [LEVEL] tag: message} lines.
 * Records below the threshold are dropped.
 */
public final class StreamDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel threshold;

    public StreamDebugSink(PrintStream out, DebugLevel threshold) {
        this.out = out;
        this.threshold = (threshold == null) ? DebugLevel.TRACE : threshold;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (!level.atLeast(threshold)) return;
        synchronized (out) {
            out.println("[" + level + "] " + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        }
    }
}
