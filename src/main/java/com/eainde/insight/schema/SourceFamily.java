package com.eainde.insight.schema;

/**
 * Physical shape of a source file.
 */
public enum SourceFamily {
    /** Row and column files (CSV exports). */
    TABULAR,
    /** Nested key/value documents (JSON exports). */
    HIERARCHICAL
}
