package com.cah.debug;

/**
 * Destination for debug records: stderr in the shell, a list in tests.
 * {@code error} is null unless the record reports a caught exception.
 */
@FunctionalInterface
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
