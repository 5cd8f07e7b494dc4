package com.rlox.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub shared by the scanner, parser and interpreter.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - No-op until a host installs a sink
 */
public final class Debug {

    // Must precede INSTANCE: static initializers run in textual order.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // nothing installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
    }

    /** Sink writing "LEVEL/tag: message" lines to stderr, dropping records below {@code minLevel}. */
    public static DebugSink consoleSink(DebugLevel minLevel) {
        return consoleSink(System.err, minLevel);
    }

    public static DebugSink consoleSink(PrintStream out, DebugLevel minLevel) {
        final DebugLevel threshold = (minLevel == null) ? DebugLevel.INFO : minLevel;
        return (level, tag, message, error) -> {
            if (!level.atLeast(threshold)) return;
            out.println(level + "/" + tag + ": " + message);
            if (error != null) error.printStackTrace(out);
        };
    }

    // Convenience methods
    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO,  tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN,  tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable err) { log(DebugLevel.ERROR, tag, msg, err); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
