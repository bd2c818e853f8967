package com.eainde.insight.ingestion;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Dot-path traversal over Jackson trees. Numeric segments index into arrays, so
 * {@code media.0.uri} and {@code media[0].uri} address the same node.
 */
public final class FieldPath {

    private FieldPath() {
    }

    public static Optional<JsonNode> resolve(JsonNode root, String path) {
        if (root == null || path == null || path.isBlank()) {
            return Optional.empty();
        }
        JsonNode current = root;
        for (String segment : segments(path)) {
            if (current == null || current.isMissingNode()) {
                return Optional.empty();
            }
            if (current.isArray()) {
                if (!isIndex(segment)) {
                    return Optional.empty();
                }
                current = current.get(Integer.parseInt(segment));
            } else if (current.isObject()) {
                current = current.get(segment);
            } else {
                return Optional.empty();
            }
        }
        return current == null || current.isMissingNode() ? Optional.empty() : Optional.of(current);
    }

    static String[] segments(String path) {
        String normalized = path.trim().replaceAll("\\[(\\d+)]", ".$1");
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.split("\\.");
    }

    private static boolean isIndex(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
