package com.eainde.insight.model;

/**
 * How totals from a pre-aggregated file are folded into per-date buckets.
 */
public enum AggregationPolicy {

    /** Each aggregate row lands on the bucket of its own date. */
    SINGLE_DAY,

    /**
     * The file's count totals are spread evenly over the platform's existing buckets.
     * Falls back to {@link #SINGLE_DAY} when the platform has no buckets yet.
     */
    EVEN_DISTRIBUTION
}
