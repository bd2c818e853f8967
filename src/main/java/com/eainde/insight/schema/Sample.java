package com.eainde.insight.schema;

import java.util.List;

/**
 * Bounded view of a source file handed to the schema oracle: the field names and the first
 * few rows or entries.
 *
 * @param fileName file name only, no directories
 * @param family   physical shape of the file
 * @param fields   column names, or flattened dot paths of the first entry
 * @param rows     first rows as maps, or first entries as JSON trees
 */
public record Sample(String fileName, SourceFamily family, List<String> fields, List<Object> rows) {

    public static final int MAX_ROWS = 5;

    public Sample {
        fields = List.copyOf(fields);
        rows = List.copyOf(rows.subList(0, Math.min(rows.size(), MAX_ROWS)));
    }
}
