package com.eainde.insight.model;

import java.util.List;
import java.util.Objects;

/**
 * A single analytic conclusion produced by a platform analyzer or by synthesis.
 *
 * @param title          short headline
 * @param summary        narrative or statistical summary
 * @param metricBasis    metrics the conclusion is derived from, e.g. "impressions"
 * @param timeRange      period the evidence covers, e.g. "2024-01-01 to 2024-01-30"
 * @param confidence     how much history backs the conclusion
 * @param evidence       numeric facts, one per line
 * @param recommendation suggested action
 */
public record Finding(
        String title,
        String summary,
        String metricBasis,
        String timeRange,
        Confidence confidence,
        List<String> evidence,
        String recommendation
) {

    public Finding {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(confidence, "confidence");
        summary = summary == null ? "" : summary;
        metricBasis = metricBasis == null ? "" : metricBasis;
        timeRange = timeRange == null ? "" : timeRange;
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        recommendation = recommendation == null ? "" : recommendation;
    }
}
