package com.eainde.insight.schema;

import java.util.Arrays;

/**
 * Classification of a source file. Labels the oracle returns that match none of the
 * known kinds become {@link #UNCLASSIFIED}.
 */
public enum SourceKind {
    CONTENT,
    POSTS,
    FOLLOWERS,
    VISITORS,
    TRAFFIC,
    REACH,
    AUDIENCE,
    OTHER,
    UNCLASSIFIED;

    public String label() {
        return name().toLowerCase();
    }

    public static SourceKind fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return UNCLASSIFIED;
        }
        String normalized = label.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        return Arrays.stream(values())
                .filter(k -> k.name().equals(normalized))
                .findFirst()
                .orElse(UNCLASSIFIED);
    }
}
