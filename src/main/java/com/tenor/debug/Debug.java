package com.tenor.debug;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide logging hub used by the elaborator and the evaluator.
 *
 * Silent by default. Hosts install a sink with {@link #setSink(DebugSink)},
 * {@link #useSysOut()} or {@link #useSlf4j()}.
 */
public final class Debug {

    // NOOP must be initialised before INSTANCE, whose constructor reads it.
    private static final DebugSink NOOP = (level, tag, message, error) -> { };

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

    public boolean isSilent() {
        return sinkRef.get() == NOOP;
    }

    /** Installs a sink printing "LEVEL/tag: message" lines; WARN and ERROR go to stderr. */
    public static void useSysOut() {
        INSTANCE.setSink((level, tag, message, error) -> {
            String line = level + "/" + tag + ": " + message;
            if (level == DebugLevel.WARN || level == DebugLevel.ERROR) {
                System.err.println(line);
                if (error != null) error.printStackTrace(System.err);
            } else {
                System.out.println(line);
            }
        });
    }

    public static void useSlf4j() {
        INSTANCE.setSink(new Slf4jDebugSink());
    }

    public void t(String tag, String msg) { log(DebugLevel.TRACE, tag, msg, null); }
    public void d(String tag, String msg) { log(DebugLevel.DEBUG, tag, msg, null); }
    public void i(String tag, String msg) { log(DebugLevel.INFO, tag, msg, null); }
    public void w(String tag, String msg) { log(DebugLevel.WARN, tag, msg, null); }
    public void e(String tag, String msg) { log(DebugLevel.ERROR, tag, msg, null); }
    public void e(String tag, String msg, Throwable error) { log(DebugLevel.ERROR, tag, msg, error); }

    public void log(DebugLevel level, String tag, String message, Throwable error) {
        sinkRef.get().log(level, tag, message, error);
    }
}
