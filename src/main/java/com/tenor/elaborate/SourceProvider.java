package com.tenor.elaborate;

import java.io.IOException;
import java.nio.file.Path;

/** Supplies contract source text to Pass 1. */
public interface SourceProvider {

    String read(Path path) throws IOException;

    /** Absolute, normalized form of {@code path}; used for cycle and escape checks. */
    Path canonicalize(Path path) throws IOException;
}
