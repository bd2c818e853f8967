package com.eainde.insight.oracle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Cleans and structurally repairs JSON returned by a language model.
 *
 * <p>A response cut off by the output token cap usually ends inside a string or value. Repair
 * walks the text once, remembering the last position where everything before it is a complete
 * prefix of valid JSON, then cuts there and re-closes the open braces and brackets in order:
 *
 * <pre>
 * {"sourceKind":"content","mappings":{"impressions":"Impr
 *   → {"sourceKind":"content","mappings":{}}
 * </pre>
 *
 * The incomplete trailing entry is dropped, never guessed.
 */
public final class JsonRepair {

    private JsonRepair() {
    }

    /**
     * Strips markdown code fences and any prose before the first brace or bracket.
     */
    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = raw.trim();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline >= 0 ? text.substring(firstNewline + 1) : text.substring(3);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
            text = text.trim();
        }
        int start = firstStructural(text);
        return start > 0 ? text.substring(start) : text;
    }

    /**
     * Repairs a possibly truncated JSON object or array.
     *
     * @return the repaired text, the complete value unchanged when nothing was cut off,
     * or empty when no JSON container starts in {@code raw}
     */
    public static Optional<String> repair(String raw) {
        String text = clean(raw);
        int start = firstStructural(text);
        if (start < 0) {
            return Optional.empty();
        }

        Deque<Character> closers = new ArrayDeque<>();
        boolean inString = false;
        boolean escaped = false;
        boolean stringIsKey = false;
        char lastSignificant = 0;

        int cut = -1;
        String cutClosers = "";

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);

            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                    lastSignificant = '"';
                    if (!stringIsKey) {
                        cut = i + 1;
                        cutClosers = pending(closers);
                    }
                }
                continue;
            }

            switch (c) {
                case '"' -> {
                    inString = true;
                    stringIsKey = !closers.isEmpty() && closers.peek() == '}'
                            && (lastSignificant == '{' || lastSignificant == ',');
                }
                case '{', '[' -> {
                    closers.push(c == '{' ? '}' : ']');
                    lastSignificant = c;
                    cut = i + 1;
                    cutClosers = pending(closers);
                }
                case '}', ']' -> {
                    if (closers.isEmpty() || closers.peek() != c) {
                        return Optional.empty();
                    }
                    closers.pop();
                    lastSignificant = c;
                    if (closers.isEmpty()) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                    cut = i + 1;
                    cutClosers = pending(closers);
                }
                case ',' -> {
                    cut = i;
                    cutClosers = pending(closers);
                    lastSignificant = c;
                }
                default -> {
                    if (!Character.isWhitespace(c)) {
                        lastSignificant = c;
                    }
                }
            }
        }

        if (cut < 0) {
            return Optional.empty();
        }
        String prefix = text.substring(start, cut).stripTrailing();
        while (prefix.endsWith(",")) {
            prefix = prefix.substring(0, prefix.length() - 1).stripTrailing();
        }
        return Optional.of(prefix + cutClosers);
    }

    private static String pending(Deque<Character> closers) {
        StringBuilder sb = new StringBuilder(closers.size());
        closers.forEach(sb::append);
        return sb.toString();
    }

    private static int firstStructural(String text) {
        int brace = text.indexOf('{');
        int bracket = text.indexOf('[');
        if (brace < 0) return bracket;
        if (bracket < 0) return brace;
        return Math.min(brace, bracket);
    }
}
