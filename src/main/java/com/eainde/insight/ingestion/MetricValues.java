package com.eainde.insight.ingestion;

import java.util.OptionalDouble;
import java.util.Set;

/**
 * Coerces raw cell or node text into metric values. Thousands separators are stripped and a
 * trailing {@code %} divides by 100. Blank cells and placeholders such as {@code -} or
 * {@code N/A} mean "no value".
 */
final class MetricValues {

    private static final Set<String> PLACEHOLDERS = Set.of("-", "--", "n/a", "na", "null", "none");

    private MetricValues() {
    }

    static OptionalDouble parse(String raw) throws RowExtractionException {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String text = raw.trim();
        if (text.isEmpty() || PLACEHOLDERS.contains(text.toLowerCase())) {
            return OptionalDouble.empty();
        }
        boolean percent = text.endsWith("%");
        if (percent) {
            text = text.substring(0, text.length() - 1).trim();
        }
        text = text.replace(",", "").replace(" ", "");
        try {
            double value = Double.parseDouble(text);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(percent ? value / 100.0 : value);
        } catch (NumberFormatException e) {
            throw new RowExtractionException("Not a number: '" + raw + "'");
        }
    }
}
