package com.eainde.insight.analysis;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.TypedRecord;

import java.util.List;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Per-platform parameters of the shared analysis: which fields measure volume, efficiency and
 * quality, the quality benchmark, and the analyst persona used for narratives.
 *
 * @param volumeField           daily reach-type count
 * @param efficiencyNumerator   numerator of the efficiency ratio
 * @param efficiencyDenominator denominator of the efficiency ratio
 * @param efficiencyAsPercent   render the ratio as a percentage
 * @param rateField             quality rate
 * @param higherRateIsBetter    false for loss rates such as bounce
 * @param rateThreshold         benchmark for the rate, as a fraction
 * @param minRecords            below this many records the platform yields no findings
 * @param windowDays            length of the trailing and prior comparison windows
 */
public record PlatformProfile(
        Platform platform,
        String analystPersona,
        MetricField volumeField,
        MetricField efficiencyNumerator,
        MetricField efficiencyDenominator,
        String efficiencyLabel,
        boolean efficiencyAsPercent,
        MetricField rateField,
        boolean higherRateIsBetter,
        double rateThreshold,
        int minRecords,
        int windowDays
) {

    public static final int DEFAULT_MIN_RECORDS = 7;
    public static final int DEFAULT_WINDOW_DAYS = 30;

    public static PlatformProfile linkedin() {
        return new PlatformProfile(Platform.LINKEDIN,
                "You are a B2B social media analyst specialising in LinkedIn company pages.",
                MetricField.IMPRESSIONS, MetricField.REACTIONS, MetricField.IMPRESSIONS,
                "Reactions per impression", true,
                MetricField.ENGAGEMENT_RATE, true, 0.05,
                DEFAULT_MIN_RECORDS, DEFAULT_WINDOW_DAYS);
    }

    public static PlatformProfile instagram() {
        return new PlatformProfile(Platform.INSTAGRAM,
                "You are a social media analyst specialising in Instagram growth and engagement.",
                MetricField.IMPRESSIONS, MetricField.LIKES, MetricField.IMPRESSIONS,
                "Likes per impression", true,
                MetricField.ENGAGEMENT_RATE, true, 0.10,
                DEFAULT_MIN_RECORDS, DEFAULT_WINDOW_DAYS);
    }

    public static PlatformProfile website() {
        return new PlatformProfile(Platform.WEBSITE,
                "You are a web analytics specialist focused on traffic quality and visitor engagement.",
                MetricField.PAGE_VIEWS, MetricField.PAGE_VIEWS, MetricField.UNIQUE_VISITORS,
                "Pages per visitor", false,
                MetricField.BOUNCE_RATE, false, 0.50,
                DEFAULT_MIN_RECORDS, DEFAULT_WINDOW_DAYS);
    }

    public static List<PlatformProfile> defaults() {
        return List.of(linkedin(), instagram(), website());
    }

    public PlatformProfile withLimits(int minRecords, int windowDays) {
        return new PlatformProfile(platform, analystPersona, volumeField, efficiencyNumerator,
                efficiencyDenominator, efficiencyLabel, efficiencyAsPercent, rateField,
                higherRateIsBetter, rateThreshold, minRecords, windowDays);
    }

    /** Efficiency ratio of one record; empty when either side is missing or the denominator is zero. */
    public Function<TypedRecord, OptionalDouble> efficiency() {
        return MetricStatistics.ratio(efficiencyNumerator, efficiencyDenominator);
    }

    /**
     * How far the rate misses its benchmark, relative to the benchmark. Positive means worse
     * than the benchmark.
     */
    public double benchmarkGap(double rate) {
        double gap = (rate - rateThreshold) / rateThreshold;
        return higherRateIsBetter ? -gap : gap;
    }
}
