package com.valyxo.debug;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Global debug hub for all Valyxo components.
 *
 * - Singleton access via Debug.get()
 * - Pluggable sink via setSink(...)
 * - Safe default (no-op) if no sink installed
 *
 * Script output never goes through here; print statements only touch the runtime's output buffer.
 */
public final class Debug {

    // NOOP must be initialized before INSTANCE; the constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> {
        // no sink installed
    };

    private static final Debug INSTANCE = new Debug();

    private final AtomicReference<DebugSink> sinkRef = new AtomicReference<>(NOOP);

    private Debug() {}

    public static Debug get() {
        return INSTANCE;
    }

    /** Installs a console sink: WARN and ERROR go to stderr, everything at or above {@code min} is printed. */
    public static void useSysOut(DebugLevel min) {
        final DebugLevel floor = (min == null) ? DebugLevel.INFO : min;
        INSTANCE.setSink((level, tag, message, error) -> {
            if (!level.isAtLeast(floor)) return;
            PrintStream out = level.isAtLeast(DebugLevel.WARN) ? System.err : System.out;
            out.println("[" + level + "][" + tag + "] " + message);
            if (error != null) error.printStackTrace(out);
        });
    }

    public static void useSysOut() {
        useSysOut(DebugLevel.INFO);
    }

    public void setSink(DebugSink sink) {
        sinkRef.set(sink == null ? NOOP : sink);
    }

    public DebugSink getSink() {
        return sinkRef.get();
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
