package com.eainde.insight.schema;

/**
 * Whether a file holds one row per period ({@link #PER_ROW}) or already-summed totals
 * ({@link #PRE_AGGREGATED}).
 */
public enum AggregationLevel {
    PER_ROW,
    PRE_AGGREGATED;

    public static AggregationLevel fromLabel(String label) {
        if (label == null) {
            return PER_ROW;
        }
        String normalized = label.trim().toLowerCase().replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "pre_aggregated", "aggregated", "aggregate", "total", "totals" -> PRE_AGGREGATED;
            default -> PER_ROW;
        };
    }
}
