package com.eainde.insight.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Canonical metric fields. Every source column or JSON path is mapped onto one of these,
 * anything else is dropped at the {@link TypedRecord} layer.
 *
 * <p>{@link Kind#COUNT} values are summed when two records for the same date meet,
 * {@link Kind#RATE} values are averaged.
 */
public enum MetricField {

    IMPRESSIONS("impressions", "Impressions", Kind.COUNT),
    CLICKS("clicks", "Clicks", Kind.COUNT),
    REACTIONS("reactions", "Reactions", Kind.COUNT),
    ENGAGEMENT_RATE("engagement_rate", "Engagement rate", Kind.RATE),
    REACH("reach", "Accounts reached", Kind.COUNT),
    LIKES("likes", "Likes", Kind.COUNT),
    COMMENTS("comments", "Comments", Kind.COUNT),
    SHARES("shares", "Shares", Kind.COUNT),
    PAGE_VIEWS("page_views", "Page views", Kind.COUNT),
    UNIQUE_VISITORS("unique_visitors", "Unique visitors", Kind.COUNT),
    BOUNCE_RATE("bounce_rate", "Bounce rate", Kind.RATE),
    ORGANIC_FOLLOWERS("organic_followers", "Organic followers", Kind.COUNT),
    SPONSORED_FOLLOWERS("sponsored_followers", "Sponsored followers", Kind.COUNT),
    TOTAL_FOLLOWERS("total_followers", "Total followers", Kind.COUNT);

    public enum Kind { COUNT, RATE }

    private final String key;
    private final String label;
    private final Kind kind;

    MetricField(String key, String label, Kind kind) {
        this.key = key;
        this.label = label;
        this.kind = kind;
    }

    /** snake_case name used in oracle prompts and responses. */
    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRate() {
        return kind == Kind.RATE;
    }

    public static Optional<MetricField> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(f -> f.key.equals(normalized))
                .findFirst();
    }
}
