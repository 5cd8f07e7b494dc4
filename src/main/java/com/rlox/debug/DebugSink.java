package com.rlox.debug;

/** Pluggable debug output target (stderr, test collector, host logger, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
