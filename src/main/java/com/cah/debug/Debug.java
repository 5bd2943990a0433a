package com.cah.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide log hub shared by the scanner, parser, evaluator and shells.
 *
 * Nothing is written until a sink is installed. Records below the hub level
 * are dropped before they reach the sink; callers building costly messages
 * can ask {@link #enabled(DebugLevel)} first.
 */
public final class Debug {

    public static final String LEXER = "cah.lexer";
    public static final String PARSER = "cah.parser";
    public static final String INTERPRETER = "cah.interpreter";
    public static final String ENGINE = "cah.engine";
    public static final String REPL = "cah.repl";
    public static final String CLI = "cah.cli";

    // must be initialized before INSTANCE, whose constructor reads it
    private static final DebugSink DISCARD = (level, tag, message, error) -> { };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sink = new AtomicReference<>(DISCARD);
    private volatile DebugLevel level = DebugLevel.TRACE;

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs {@code next}; null means discard everything. */
    public void setSink(DebugSink next) {
        sink.set(next == null ? DISCARD : next);
    }

    public DebugSink getSink() {
        return sink.get();
    }

    public void setLevel(DebugLevel min) {
        this.level = (min == null) ? DebugLevel.TRACE : min;
    }

    public DebugLevel getLevel() {
        return level;
    }

    /** False when no sink is installed or {@code at} is below the hub level. */
    public boolean enabled(DebugLevel at) {
        return sink.get() != DISCARD && at.atLeast(level);
    }

    /** Back to no sink and no level filter. Tests call this between cases. */
    public void reset() {
        sink.set(DISCARD);
        level = DebugLevel.TRACE;
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel at, String tag, String message, Throwable error) {
        if (!at.atLeast(level)) return;
        sink.get().log(at, tag, message, error);
    }
}
