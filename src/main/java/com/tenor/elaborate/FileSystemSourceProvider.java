package com.tenor.elaborate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class FileSystemSourceProvider implements SourceProvider {

    @Override
    public String read(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    @Override
    public Path canonicalize(Path path) throws IOException {
        return path.toRealPath();
    }
}
