package com.eainde.insight.ingestion;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Multi-format date parsing for source time keys.
 *
 * <p>Order of attempts:
 * <ol>
 *   <li>the mapping's format hint (Java pattern or strftime style such as {@code %m/%d/%Y})</li>
 *   <li>epoch seconds (10 digits) or milliseconds (13 digits), UTC</li>
 *   <li>a fixed list of common export formats, month-first before day-first</li>
 *   <li>a lenient parse of the first {@code a/b/c} group found in the text</li>
 * </ol>
 */
public final class DateParser {

    private static final List<DateTimeFormatter> KNOWN_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("M/d/uuuu"),
            strict("d/M/uuuu"),
            strict("uuuu/M/d"),
            strict("d-M-uuuu"),
            strict("d.M.uuuu"),
            strict("uuuuMMdd"),
            strict("MMM d, uuuu"),
            strict("d MMM uuuu"),
            strict("MMMM d, uuuu"),
            strict("d MMMM uuuu"));

    private static final Pattern EPOCH = Pattern.compile("\\d{9,10}|\\d{12,13}");
    private static final Pattern DATE_GROUP = Pattern.compile("(\\d{1,4})[-/.](\\d{1,2})[-/.](\\d{1,4})");

    private DateParser() {
    }

    public static Optional<LocalDate> parse(String raw) {
        return parse(raw, null);
    }

    public static Optional<LocalDate> parse(String raw, String formatHint) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();

        if (formatHint != null && !formatHint.isBlank()) {
            Optional<LocalDate> hinted = tryFormat(text, formatHint);
            if (hinted.isPresent()) {
                return hinted;
            }
        }

        String numeric = text.endsWith(".0") ? text.substring(0, text.length() - 2) : text;
        if (EPOCH.matcher(numeric).matches()) {
            long value = Long.parseLong(numeric);
            Instant instant = numeric.length() > 10 ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
            return Optional.of(instant.atZone(ZoneOffset.UTC).toLocalDate());
        }

        for (DateTimeFormatter format : KNOWN_FORMATS) {
            Optional<LocalDate> parsed = tryFormat(text, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return lenient(text);
    }

    /**
     * Converts a strftime-style pattern to a {@link DateTimeFormatter} pattern; Java patterns
     * pass through with {@code y} widened to {@code u} for strict resolving.
     */
    static String toJavaPattern(String hint) {
        if (hint.contains("%")) {
            return hint.replace("%Y", "uuuu")
                    .replace("%y", "uu")
                    .replace("%m", "MM")
                    .replace("%d", "dd")
                    .replace("%B", "MMMM")
                    .replace("%b", "MMM")
                    .replace("%H", "HH")
                    .replace("%M", "mm")
                    .replace("%S", "ss");
        }
        return hint.replace('y', 'u');
    }

    private static Optional<LocalDate> tryFormat(String text, String hint) {
        DateTimeFormatter formatter;
        try {
            formatter = strict(toJavaPattern(hint));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return tryFormat(text, formatter);
    }

    private static Optional<LocalDate> tryFormat(String text, DateTimeFormatter formatter) {
        try {
            return Optional.of(LocalDate.parse(text, formatter));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> lenient(String text) {
        Matcher m = DATE_GROUP.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        String a = m.group(1);
        String b = m.group(2);
        String c = m.group(3);
        try {
            if (a.length() == 4) {
                return Optional.of(LocalDate.of(Integer.parseInt(a), Integer.parseInt(b), Integer.parseInt(c)));
            }
            int first = Integer.parseInt(a);
            int second = Integer.parseInt(b);
            int year = Integer.parseInt(c);
            if (c.length() <= 2) {
                year += 2000;
            }
            return first > 12
                    ? Optional.of(LocalDate.of(year, second, first))
                    : Optional.of(LocalDate.of(year, first, second));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH).withResolverStyle(ResolverStyle.STRICT);
    }
}
