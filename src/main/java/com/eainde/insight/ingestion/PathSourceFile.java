package com.eainde.insight.ingestion;

import com.eainde.insight.model.Platform;
import com.eainde.insight.schema.FileFingerprint;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link SourceFile} on the local file system, read as UTF-8.
 */
public class PathSourceFile implements SourceFile {

    private final Path path;
    private final Platform platform;

    public PathSourceFile(Path path, Platform platform) {
        this.path = Objects.requireNonNull(path, "path");
        this.platform = Objects.requireNonNull(platform, "platform");
    }

    @Override
    public String name() {
        return path.getFileName().toString();
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public FileFingerprint fingerprint() throws IOException {
        return new FileFingerprint(path.toAbsolutePath().normalize().toString(),
                Files.getLastModifiedTime(path).toMillis());
    }

    @Override
    public Reader openReader() throws IOException {
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    public Path path() {
        return path;
    }

    @Override
    public String toString() {
        return path + " [" + platform.key() + "]";
    }
}
