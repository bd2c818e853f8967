package com.eainde.insight.model;

/**
 * Why a source file contributed no records.
 */
public enum SkipReason {
    /** No oracle classification and no filename heuristic matched. */
    UNCLASSIFIED,
    /** Classified, but the kind carries no time series (audience breakdowns and similar). */
    UNMAPPABLE,
    /** The file could not be read or parsed. */
    UNREADABLE,
    /** The file parsed but holds no rows or entries. */
    EMPTY,
    /** A mapping was applied but every row was dropped. */
    NO_RECORDS
}
