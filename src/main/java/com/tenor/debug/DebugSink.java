package com.tenor.debug;

/** Pluggable debug output target (stdout, SLF4J, test capture, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
