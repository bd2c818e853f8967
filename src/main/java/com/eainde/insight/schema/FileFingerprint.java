package com.eainde.insight.schema;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of one version of a source file: its path plus its modification time.
 * Editing the file changes {@code lastModifiedMillis} and therefore the fingerprint.
 */
public record FileFingerprint(String path, long lastModifiedMillis) {

    public FileFingerprint {
        Objects.requireNonNull(path, "path");
    }

    /**
     * Stable SHA-256 hex digest of path and modification time, used as the cache key.
     */
    public String digest() {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] hash = sha.digest((path + "|" + lastModifiedMillis).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
