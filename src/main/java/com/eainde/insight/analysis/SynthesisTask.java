package com.eainde.insight.analysis;

import com.eainde.insight.model.Confidence;
import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.model.UnifiedStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Cross-platform synthesis over the platforms whose analysis produced findings.
 *
 * <p>Answers four questions independently; a failure in one is logged and leaves the others
 * untouched:
 * <ol>
 *   <li>trend direction: volume growth per platform</li>
 *   <li>leakage: which platform misses its quality benchmark the most</li>
 *   <li>prioritisation: composite of rate quality and growth, ranked</li>
 *   <li>levers: the strongest actions across the platform recommendations</li>
 * </ol>
 */
@Slf4j
public class SynthesisTask {

    public static final String NAME = "synthesis";

    static final String TREND_TITLE = "Cross-Platform Growth Trend";
    static final String LEAKAGE_TITLE = "Engagement Leakage";
    static final String PRIORITY_TITLE = "Platform Prioritization";
    static final String LEVERS_TITLE = "Recommended Levers";

    private static final String STRATEGIST = "You are a senior marketing strategist advising on channel investment.";
    private static final int MAX_LEVERS = 5;

    private final NarrativeWriter narrativeWriter;
    private final Map<Platform, PlatformProfile> profiles = new EnumMap<>(Platform.class);

    public SynthesisTask(NarrativeWriter narrativeWriter, List<PlatformProfile> profiles) {
        this.narrativeWriter = narrativeWriter;
        profiles.forEach(p -> this.profiles.put(p.platform(), p));
    }

    /**
     * @param platformFindings findings of the platform analyses; at least one list must be
     *                         non-empty
     * @throws IllegalArgumentException when no platform has findings
     */
    public List<Finding> synthesize(UnifiedStore store, Map<Platform, List<Finding>> platformFindings) {
        List<PlatformProfile> active = platformFindings.entrySet().stream()
                .filter(e -> !e.getValue().isEmpty() && profiles.containsKey(e.getKey()))
                .map(e -> profiles.get(e.getKey()))
                .sorted(Comparator.comparing(PlatformProfile::platform))
                .toList();
        if (active.isEmpty()) {
            throw new IllegalArgumentException("Synthesis needs at least one platform with findings");
        }

        List<Finding> findings = new ArrayList<>();
        answer("trend direction", () -> trendDirection(store, active), findings);
        answer("leakage", () -> leakage(store, active), findings);
        answer("prioritization", () -> prioritization(store, active), findings);
        answer("levers", () -> levers(active, platformFindings), findings);

        log.info("Synthesis produced {} of 4 finding(s) over {}", findings.size(),
                active.stream().map(p -> p.platform().key()).toList());
        return findings;
    }

    private void answer(String question, Supplier<Optional<Finding>> body, List<Finding> out) {
        try {
            body.get().ifPresentOrElse(out::add,
                    () -> log.info("Synthesis question '{}' has no data to answer", question));
        } catch (RuntimeException e) {
            log.warn("Synthesis question '{}' failed; continuing with the others", question, e);
        }
    }

    // =========================================================================
    //  Questions
    // =========================================================================

    private Optional<Finding> trendDirection(UnifiedStore store, List<PlatformProfile> active) {
        Map<Platform, Double> growth = new EnumMap<>(Platform.class);
        boolean fullWindows = true;
        for (PlatformProfile profile : active) {
            Optional<MetricStatistics.PeriodComparison> cmp = MetricStatistics.compare(
                    store.records(profile.platform()), MetricStatistics.field(profile.volumeField()), profile.windowDays());
            if (cmp.isPresent() && cmp.get().changePct().isPresent()) {
                growth.put(profile.platform(), cmp.get().changePct().getAsDouble());
                fullWindows &= cmp.get().priorCount() >= profile.windowDays();
            }
        }
        if (growth.isEmpty()) {
            return Optional.empty();
        }

        long growing = growth.values().stream().filter(g -> g >= 5.0).count();
        long declining = growth.values().stream().filter(g -> g <= -5.0).count();
        String overall = growing > 0 && declining == 0 ? "growing"
                : declining > 0 && growing == 0 ? "declining"
                : growing == 0 ? "flat" : "mixed";

        List<String> evidence = growth.entrySet().stream()
                .map(e -> String.format(Locale.ROOT, "%s %s growth: %+.1f%%",
                        e.getKey().displayName(), profiles.get(e.getKey()).volumeField().label().toLowerCase(Locale.ROOT),
                        e.getValue()))
                .toList();
        Platform fastest = growth.entrySet().stream().max(Map.Entry.comparingByValue()).orElseThrow().getKey();
        String summary = "Overall marketing reach is " + overall + " across " + growth.size()
                + " platform(s); " + fastest.displayName() + " shows the strongest momentum.";
        String recommendation = "declining".equals(overall)
                ? "Reach is contracting everywhere; revisit content strategy before increasing spend."
                : "Double down on " + fastest.displayName() + " while it has momentum.";
        Confidence confidence = fullWindows ? (growth.size() > 1 ? Confidence.HIGH : Confidence.MEDIUM) : Confidence.LOW;

        return Optional.of(narrate(TREND_TITLE, "volume growth, trailing vs prior window", confidence, evidence,
                summary, recommendation, "Is overall marketing performance growing or declining, and where?"));
    }

    private Optional<Finding> leakage(UnifiedStore store, List<PlatformProfile> active) {
        Map<Platform, Double> rates = recentRates(store, active);
        if (rates.isEmpty()) {
            return Optional.empty();
        }

        List<String> evidence = new ArrayList<>();
        Platform worst = null;
        double worstGap = Double.NEGATIVE_INFINITY;
        for (Map.Entry<Platform, Double> entry : rates.entrySet()) {
            PlatformProfile profile = profiles.get(entry.getKey());
            double gap = profile.benchmarkGap(entry.getValue());
            evidence.add(String.format(Locale.ROOT, "%s %s: %s (benchmark %s %s)",
                    entry.getKey().displayName(), profile.rateField().label().toLowerCase(Locale.ROOT),
                    PlatformAnalyzer.percent(entry.getValue()),
                    profile.higherRateIsBetter() ? "at least" : "at most",
                    PlatformAnalyzer.percent(profile.rateThreshold())));
            if (gap > worstGap) {
                worstGap = gap;
                worst = entry.getKey();
            }
        }

        PlatformProfile worstProfile = profiles.get(worst);
        String rateLabel = worstProfile.rateField().label().toLowerCase(Locale.ROOT);
        String summary = worstGap > 0
                ? String.format(Locale.ROOT, "%s leaks the most: its %s misses the benchmark by %.0f%%.",
                        worst.displayName(), rateLabel, worstGap * 100.0)
                : "Every analysed platform meets its quality benchmark; " + worst.displayName()
                        + " has the smallest margin on " + rateLabel + ".";
        String recommendation = worstProfile.higherRateIsBetter()
                ? "Lift " + rateLabel + " on " + worst.displayName() + " with stronger calls to action and audience-fit content."
                : "Reduce " + rateLabel + " on " + worst.displayName() + " by improving landing relevance and internal linking.";

        return Optional.of(narrate(LEAKAGE_TITLE, "quality rate against benchmark", Confidence.MEDIUM, evidence,
                summary, recommendation, "Where is the audience being lost, and which platform leaks the most?"));
    }

    private Optional<Finding> prioritization(UnifiedStore store, List<PlatformProfile> active) {
        Map<Platform, Double> rates = recentRates(store, active);
        Map<Platform, Double> scores = new EnumMap<>(Platform.class);
        for (PlatformProfile profile : active) {
            OptionalDouble growth = MetricStatistics.compare(store.records(profile.platform()),
                            MetricStatistics.field(profile.volumeField()), profile.windowDays())
                    .map(MetricStatistics.PeriodComparison::changePct)
                    .orElse(OptionalDouble.empty());
            Double rate = rates.get(profile.platform());
            if (rate == null && growth.isEmpty()) {
                continue;
            }
            double quality = rate == null ? 0.0 : profile.higherRateIsBetter() ? rate : (1.0 - rate) / 2.0;
            scores.put(profile.platform(), quality * 10.0 + growth.orElse(0.0) / 10.0);
        }
        if (scores.isEmpty()) {
            return Optional.empty();
        }

        List<Map.Entry<Platform, Double>> ranked = scores.entrySet().stream()
                .sorted(Map.Entry.<Platform, Double>comparingByValue().reversed())
                .toList();
        List<String> evidence = new ArrayList<>();
        for (int i = 0; i < ranked.size(); i++) {
            evidence.add(String.format(Locale.ROOT, "#%d %s: score %.2f",
                    i + 1, ranked.get(i).getKey().displayName(), ranked.get(i).getValue()));
        }
        String order = ranked.stream().map(e -> e.getKey().displayName()).collect(Collectors.joining(", then "));
        Platform top = ranked.get(0).getKey();
        String summary = "Based on quality and growth, prioritise " + order + ".";
        String recommendation = "Shift incremental effort towards " + top.displayName()
                + (ranked.size() > 1 ? " and review the return on " + ranked.get(ranked.size() - 1).getKey().displayName() + "." : ".");

        return Optional.of(narrate(PRIORITY_TITLE, "rate quality x10 + growth / 10",
                ranked.size() > 1 ? Confidence.MEDIUM : Confidence.LOW, evidence, summary, recommendation,
                "Which platforms should get priority for the next quarter?"));
    }

    private Optional<Finding> levers(List<PlatformProfile> active, Map<Platform, List<Finding>> platformFindings) {
        Set<String> actions = new LinkedHashSet<>();
        for (PlatformProfile profile : active) {
            for (Finding finding : platformFindings.getOrDefault(profile.platform(), List.of())) {
                if (!finding.recommendation().isBlank()) {
                    actions.add(finding.recommendation());
                }
            }
        }
        if (actions.isEmpty()) {
            return Optional.empty();
        }
        List<String> top = actions.stream().limit(MAX_LEVERS).toList();
        String summary = "The strongest levers across channels: " + String.join(" ", top.subList(0, Math.min(3, top.size())));
        String recommendation = top.get(0);
        Confidence confidence = active.size() >= 3 ? Confidence.HIGH : active.size() == 2 ? Confidence.MEDIUM : Confidence.LOW;

        return Optional.of(narrate(LEVERS_TITLE, "platform recommendations", confidence, top,
                summary, recommendation, "What are the most impactful actions to take next across all channels?"));
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private Map<Platform, Double> recentRates(UnifiedStore store, List<PlatformProfile> active) {
        Map<Platform, Double> rates = new EnumMap<>(Platform.class);
        for (PlatformProfile profile : active) {
            List<TypedRecord> records = store.records(profile.platform());
            List<TypedRecord> recent = records.subList(Math.max(0, records.size() - profile.windowDays()), records.size());
            MetricStatistics.average(recent, MetricStatistics.field(profile.rateField()))
                    .ifPresent(rate -> rates.put(profile.platform(), rate));
        }
        return rates;
    }

    private Finding narrate(String title, String metricBasis, Confidence confidence, List<String> evidence,
                            String summary, String recommendation, String question) {
        Optional<NarrativeWriter.Narrative> narrative =
                narrativeWriter.write(NarrativeWriter.PURPOSE_STRATEGY, STRATEGIST, question, evidence);
        return new Finding(title,
                narrative.map(NarrativeWriter.Narrative::summary).orElse(summary),
                metricBasis,
                "",
                confidence,
                evidence,
                narrative.map(NarrativeWriter.Narrative::recommendation).filter(r -> !r.isBlank()).orElse(recommendation));
    }
}
