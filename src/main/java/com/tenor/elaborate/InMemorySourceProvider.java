package com.tenor.elaborate;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/** Serves sources from a map keyed by path; used by tests and embedding hosts. */
public final class InMemorySourceProvider implements SourceProvider {

    private final Map<Path, String> files = new LinkedHashMap<>();

    public InMemorySourceProvider put(String path, String source) {
        files.put(normalize(Paths.get(path)), source);
        return this;
    }

    @Override
    public String read(Path path) throws IOException {
        String s = files.get(normalize(path));
        if (s == null) throw new NoSuchFileException(path.toString());
        return s;
    }

    @Override
    public Path canonicalize(Path path) throws IOException {
        Path p = normalize(path);
        if (!files.containsKey(p)) throw new NoSuchFileException(path.toString());
        return p;
    }

    private static Path normalize(Path p) {
        return p.toAbsolutePath().normalize();
    }
}
