package com.eainde.insight.analysis;

import com.eainde.insight.model.Confidence;
import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.model.UnifiedStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Statistical analysis of one platform, parameterised by a {@link PlatformProfile}.
 *
 * <h3>Features:</h3>
 * <ol>
 *   <li>volume trend, trailing window against the prior window</li>
 *   <li>efficiency trend, same windows on the profile's ratio</li>
 *   <li>cadence, rate in busy weeks against quiet weeks (at least 4 usable weeks)</li>
 *   <li>rate distribution against the profile's benchmark</li>
 * </ol>
 * A feature without enough data is left out. Each remaining feature is narrated by the
 * {@link NarrativeWriter}; without a narrative the statistical summary and a rule-based
 * recommendation are used.
 */
@Slf4j
public class PlatformAnalyzer implements AnalysisTask {

    static final int MIN_CADENCE_WEEKS = 4;

    private final PlatformProfile profile;
    private final NarrativeWriter narrativeWriter;

    public PlatformAnalyzer(PlatformProfile profile, NarrativeWriter narrativeWriter) {
        this.profile = profile;
        this.narrativeWriter = narrativeWriter;
    }

    @Override
    public Platform platform() {
        return profile.platform();
    }

    public PlatformProfile profile() {
        return profile;
    }

    @Override
    public List<Finding> analyze(UnifiedStore store) {
        List<TypedRecord> records = store.records(profile.platform());
        if (records.size() < profile.minRecords()) {
            log.info("{}: {} record(s), below the minimum of {}; no findings",
                    platformName(), records.size(), profile.minRecords());
            return List.of();
        }

        List<Draft> drafts = new ArrayList<>();
        volumeTrend(records).ifPresent(drafts::add);
        efficiencyTrend(records).ifPresent(drafts::add);
        cadence(records).ifPresent(drafts::add);
        rateDistribution(records).ifPresent(drafts::add);

        List<Finding> findings = drafts.stream().map(this::narrate).toList();
        log.info("{}: {} finding(s) from {} record(s)", platformName(), findings.size(), records.size());
        return findings;
    }

    // =========================================================================
    //  Features
    // =========================================================================

    private Optional<Draft> volumeTrend(List<TypedRecord> records) {
        String label = profile.volumeField().label();
        return MetricStatistics.compare(records, MetricStatistics.field(profile.volumeField()), profile.windowDays())
                .map(cmp -> {
                    List<String> evidence = new ArrayList<>();
                    evidence.add(String.format(Locale.ROOT, "Average daily %s, last %d days: %.1f",
                            label, cmp.recentCount(), cmp.recentMean()));
                    String summary;
                    String recommendation;
                    if (cmp.changePct().isPresent()) {
                        double change = cmp.changePct().getAsDouble();
                        evidence.add(String.format(Locale.ROOT, "Average daily %s, prior %d days: %.1f",
                                label, cmp.priorCount(), cmp.priorMean()));
                        evidence.add(String.format(Locale.ROOT, "Change: %+.1f%%", change));
                        summary = String.format(Locale.ROOT,
                                "Average daily %s %s %.1f%% (%.1f to %.1f) over the last %d days compared with the %d days before.",
                                label.toLowerCase(Locale.ROOT), direction(change), Math.abs(change),
                                cmp.priorMean(), cmp.recentMean(), cmp.recentCount(), cmp.priorCount());
                        recommendation = volumeRecommendation(change);
                    } else {
                        summary = String.format(Locale.ROOT,
                                "Average daily %s is %.1f over the last %d days; there is not enough history for a prior-period comparison.",
                                label.toLowerCase(Locale.ROOT), cmp.recentMean(), cmp.recentCount());
                        recommendation = "Keep collecting " + platformName()
                                + " data so the next run can compare against a full prior period.";
                    }
                    return new Draft(platformName() + ": " + label + " Trend",
                            profile.volumeField().key(), range(cmp), windowConfidence(cmp), evidence,
                            summary, recommendation,
                            "Is " + label.toLowerCase(Locale.ROOT) + " on " + platformName() + " growing or declining, and what should be done about it?");
                });
    }

    private Optional<Draft> efficiencyTrend(List<TypedRecord> records) {
        String label = profile.efficiencyLabel();
        return MetricStatistics.compare(records, profile.efficiency(), profile.windowDays())
                .filter(MetricStatistics.PeriodComparison::hasPrior)
                .map(cmp -> {
                    double change = cmp.changePct().orElse(0.0);
                    List<String> evidence = List.of(
                            label + ", last " + cmp.recentCount() + " days: " + formatEfficiency(cmp.recentMean()),
                            label + ", prior " + cmp.priorCount() + " days: " + formatEfficiency(cmp.priorMean()),
                            String.format(Locale.ROOT, "Change: %+.1f%%", change));
                    String summary = String.format(Locale.ROOT, "%s %s from %s to %s between the prior and the last period.",
                            label, direction(change), formatEfficiency(cmp.priorMean()), formatEfficiency(cmp.recentMean()));
                    String recommendation = change >= 0
                            ? "Efficiency is holding on " + platformName() + "; scale the content types behind the recent results."
                            : "Efficiency is slipping on " + platformName() + "; audit recent content quality and targeting before adding volume.";
                    return new Draft(platformName() + ": " + label,
                            profile.efficiencyNumerator().key() + "/" + profile.efficiencyDenominator().key(),
                            range(cmp), windowConfidence(cmp), evidence, summary, recommendation,
                            "How efficiently does " + platformName() + " convert exposure into engagement, and is it improving?");
                });
    }

    private Optional<Draft> cadence(List<TypedRecord> records) {
        List<MetricStatistics.WeeklyBucket> weeks = MetricStatistics.weeklyBuckets(
                records, profile.volumeField(), MetricStatistics.field(profile.rateField()));
        if (weeks.size() < MIN_CADENCE_WEEKS) {
            return Optional.empty();
        }
        MetricStatistics.CadenceContrast contrast = MetricStatistics.busyVersusQuiet(weeks);
        String rateLabel = profile.rateField().label().toLowerCase(Locale.ROOT);
        boolean busyIsBetter = profile.higherRateIsBetter()
                ? contrast.busyRate() >= contrast.quietRate()
                : contrast.busyRate() <= contrast.quietRate();

        List<String> evidence = List.of(
                "Usable weeks: " + weeks.size(),
                "Average " + rateLabel + " in the " + contrast.weeksPerSide() + " busiest weeks: " + percent(contrast.busyRate()),
                "Average " + rateLabel + " in the " + contrast.weeksPerSide() + " quietest weeks: " + percent(contrast.quietRate()));
        String summary = String.format(Locale.ROOT,
                "Across %d weeks, %s averaged %s in the busiest weeks and %s in the quietest weeks.",
                weeks.size(), rateLabel, percent(contrast.busyRate()), percent(contrast.quietRate()));
        String recommendation = busyIsBetter
                ? "Higher activity does not dilute " + rateLabel + " on " + platformName() + "; a steadier, higher cadence is low risk."
                : "Busier weeks show weaker " + rateLabel + " on " + platformName() + "; favour fewer, stronger pieces over volume.";
        Confidence confidence = weeks.size() >= 8 ? Confidence.HIGH : weeks.size() >= 6 ? Confidence.MEDIUM : Confidence.LOW;

        return Optional.of(new Draft(platformName() + ": Activity Cadence",
                profile.volumeField().key() + ", " + profile.rateField().key(),
                weeks.get(0).weekStart() + " to " + weeks.get(weeks.size() - 1).weekStart().plusDays(6),
                confidence, evidence, summary, recommendation,
                "Does " + platformName() + " activity volume help or hurt " + rateLabel + "?"));
    }

    private Optional<Draft> rateDistribution(List<TypedRecord> records) {
        MetricStatistics.ThresholdSplit split = MetricStatistics.split(
                records, profile.rateField(), profile.volumeField(), profile.rateThreshold());
        if (split.total() < profile.minRecords()) {
            return Optional.empty();
        }
        String rateLabel = profile.rateField().label().toLowerCase(Locale.ROOT);
        String volumeLabel = profile.volumeField().label().toLowerCase(Locale.ROOT);
        double goodShare = profile.higherRateIsBetter() ? split.shareAbove() : 1.0 - split.shareAbove();

        List<String> evidence = List.of(
                String.format(Locale.ROOT, "Days at or above %s %s: %d of %d",
                        percent(profile.rateThreshold()), rateLabel, split.daysAbove(), split.total()),
                String.format(Locale.ROOT, "Average %s on those days: %.1f", volumeLabel, split.volumeAbove()),
                String.format(Locale.ROOT, "Average %s on other days: %.1f", volumeLabel, split.volumeBelow()));
        String summary = String.format(Locale.ROOT,
                "%.0f%% of days met the %s %s benchmark; %s averaged %.1f on days at or above it and %.1f otherwise.",
                goodShare * 100.0, percent(profile.rateThreshold()), rateLabel,
                volumeLabel, split.volumeAbove(), split.volumeBelow());
        String recommendation = goodShare >= 0.5
                ? "Most days meet the " + rateLabel + " benchmark on " + platformName() + "; protect the formats and topics behind them."
                : "Fewer than half of days meet the " + rateLabel + " benchmark on " + platformName() + "; prioritise formats that lift it.";
        Confidence confidence = split.total() >= 60 ? Confidence.HIGH : split.total() >= 30 ? Confidence.MEDIUM : Confidence.LOW;

        return Optional.of(new Draft(platformName() + ": " + profile.rateField().label() + " Distribution",
                profile.rateField().key(),
                records.get(0).date() + " to " + records.get(records.size() - 1).date(),
                confidence, evidence, summary, recommendation,
                "How consistently does " + platformName() + " meet its " + rateLabel + " benchmark?"));
    }

    // =========================================================================
    //  Narration
    // =========================================================================

    private Finding narrate(Draft draft) {
        Optional<NarrativeWriter.Narrative> narrative = narrativeWriter.write(
                NarrativeWriter.PURPOSE_INSIGHT, profile.analystPersona(), draft.question(), draft.evidence());
        String summary = narrative.map(NarrativeWriter.Narrative::summary).orElse(draft.summary());
        String recommendation = narrative.map(NarrativeWriter.Narrative::recommendation)
                .filter(r -> !r.isBlank())
                .orElse(draft.recommendation());
        return new Finding(draft.title(), summary, draft.metricBasis(), draft.timeRange(),
                draft.confidence(), draft.evidence(), recommendation);
    }

    /** A finding before narration. */
    private record Draft(
            String title,
            String metricBasis,
            String timeRange,
            Confidence confidence,
            List<String> evidence,
            String summary,
            String recommendation,
            String question
    ) {
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private String volumeRecommendation(double change) {
        if (change >= 5.0) {
            return "Keep the current publishing approach on " + platformName()
                    + " and test scaling the formats driving the increase.";
        }
        if (change <= -5.0) {
            return "Review recent " + platformName()
                    + " content against the prior period and restore the formats that performed best.";
        }
        return "Volume is stable on " + platformName() + "; experiment with new formats or timing to unlock growth.";
    }

    private Confidence windowConfidence(MetricStatistics.PeriodComparison cmp) {
        if (cmp.priorCount() >= profile.windowDays()) {
            return Confidence.HIGH;
        }
        return cmp.hasPrior() ? Confidence.MEDIUM : Confidence.LOW;
    }

    private String formatEfficiency(double value) {
        return profile.efficiencyAsPercent() ? percent(value) : String.format(Locale.ROOT, "%.2f", value);
    }

    private String platformName() {
        return profile.platform().displayName();
    }

    static String direction(double change) {
        if (Math.abs(change) < 5.0) {
            return "held steady, moving";
        }
        return change > 0 ? "rose" : "fell";
    }

    static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.2f%%", fraction * 100.0);
    }

    private static String range(MetricStatistics.PeriodComparison cmp) {
        return cmp.recentFrom() + " to " + cmp.recentTo();
    }
}
