package com.eainde.insight.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Marketing channel a record belongs to.
 */
public enum Platform {

    LINKEDIN("LinkedIn"),
    INSTAGRAM("Instagram"),
    WEBSITE("Website");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public String key() {
        return name().toLowerCase();
    }

    /**
     * Canonical fields the channel's exports can carry; offered to the schema oracle.
     */
    public Set<MetricField> metricFields() {
        return switch (this) {
            case LINKEDIN -> EnumSet.of(MetricField.IMPRESSIONS, MetricField.CLICKS, MetricField.REACTIONS,
                    MetricField.ENGAGEMENT_RATE, MetricField.PAGE_VIEWS, MetricField.UNIQUE_VISITORS,
                    MetricField.ORGANIC_FOLLOWERS, MetricField.SPONSORED_FOLLOWERS, MetricField.TOTAL_FOLLOWERS);
            case INSTAGRAM -> EnumSet.of(MetricField.IMPRESSIONS, MetricField.REACH, MetricField.LIKES,
                    MetricField.COMMENTS, MetricField.SHARES, MetricField.ENGAGEMENT_RATE);
            case WEBSITE -> EnumSet.of(MetricField.PAGE_VIEWS, MetricField.UNIQUE_VISITORS, MetricField.BOUNCE_RATE);
        };
    }
}
