package com.eainde.insight.ingestion;

import com.eainde.insight.model.Platform;
import com.eainde.insight.schema.FileFingerprint;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * In-memory {@link SourceFile} for tests. {@link #touch()} simulates an edit.
 */
public class StubSourceFile implements SourceFile {

    private final String name;
    private final Platform platform;
    private final String content;
    private long lastModified = 1_700_000_000_000L;

    public StubSourceFile(String name, Platform platform, String content) {
        this.name = name;
        this.platform = platform;
        this.content = content;
    }

    public static StubSourceFile unreadable(String name, Platform platform) {
        return new StubSourceFile(name, platform, null);
    }

    public void touch() {
        lastModified += 1_000L;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public FileFingerprint fingerprint() {
        return new FileFingerprint("/stub/" + name, lastModified);
    }

    @Override
    public Reader openReader() throws IOException {
        if (content == null) {
            throw new IOException("permission denied: " + name);
        }
        return new StringReader(content);
    }
}
