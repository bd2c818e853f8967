package com.eainde.insight.ingestion;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.MappingOrigin;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.schema.SourceKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed filename table used when the schema oracle is unavailable or its mapping does not fit.
 *
 * <p>Rules are evaluated in order against the lower-cased file name; the first rule of the
 * file's family whose pattern is a substring wins. A rule without field paths classifies the
 * file but marks it as carrying no time series.
 */
public class FilenameHeuristics {

    public record Rule(
            String pattern,
            SourceFamily family,
            SourceKind kind,
            String timeKey,
            String dateFormat,
            String recordsPath,
            AggregationLevel aggregationLevel,
            Map<MetricField, String> fieldPaths
    ) {

        public Rule {
            fieldPaths = Map.copyOf(fieldPaths);
        }

        public boolean isMappable() {
            return !fieldPaths.isEmpty() && timeKey != null;
        }

        public SchemaMapping toMapping() {
            return SchemaMapping.builder()
                    .sourceKind(kind)
                    .timeKeyPath(timeKey)
                    .dateFormat(dateFormat)
                    .recordsPath(recordsPath)
                    .aggregationLevel(aggregationLevel)
                    .fields(fieldPaths)
                    .origin(MappingOrigin.HEURISTIC)
                    .build();
        }
    }

    private final List<Rule> rules;

    public FilenameHeuristics(List<Rule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static FilenameHeuristics defaults() {
        return new FilenameHeuristics(defaultRules());
    }

    public Optional<Rule> match(String fileName, SourceFamily family) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(r -> r.family() == family && lower.contains(r.pattern()))
                .findFirst();
    }

    public List<Rule> rules() {
        return rules;
    }

    // =========================================================================
    //  Default table
    // =========================================================================

    private static List<Rule> defaultRules() {
        List<Rule> rules = new ArrayList<>();

        // LinkedIn page exports
        rules.add(tabular("followers", SourceKind.FOLLOWERS, "Date", "MM/dd/yyyy", AggregationLevel.PER_ROW,
                fields(MetricField.ORGANIC_FOLLOWERS, "Organic followers",
                        MetricField.SPONSORED_FOLLOWERS, "Sponsored followers",
                        MetricField.TOTAL_FOLLOWERS, "Total followers")));
        rules.add(tabular("visitors", SourceKind.VISITORS, "Date", "MM/dd/yyyy", AggregationLevel.PER_ROW,
                fields(MetricField.PAGE_VIEWS, "Total page views (total)",
                        MetricField.UNIQUE_VISITORS, "Total unique visitors (total)")));

        // Website analytics
        rules.add(tabular("blog", SourceKind.CONTENT, "Action date", "dd/MM/yyyy", AggregationLevel.PER_ROW,
                fields(MetricField.PAGE_VIEWS, "Post views",
                        MetricField.UNIQUE_VISITORS, "Unique visitors",
                        MetricField.BOUNCE_RATE, "Bounce rate")));
        rules.add(tabular("traffic", SourceKind.TRAFFIC, "Date", null, AggregationLevel.PRE_AGGREGATED,
                fields(MetricField.PAGE_VIEWS, "Page views",
                        MetricField.UNIQUE_VISITORS, "Unique visitors",
                        MetricField.BOUNCE_RATE, "Bounce rate")));

        rules.add(tabular("content", SourceKind.CONTENT, "Date", "MM/dd/yyyy", AggregationLevel.PER_ROW,
                fields(MetricField.IMPRESSIONS, "Impressions (total)",
                        MetricField.CLICKS, "Clicks (total)",
                        MetricField.REACTIONS, "Reactions (total)",
                        MetricField.ENGAGEMENT_RATE, "Engagement rate (total)")));
        rules.add(tabular("competitor", SourceKind.OTHER, null, null, AggregationLevel.PER_ROW, Map.of()));

        // Instagram account exports
        Map<MetricField, String> mediaInsights = fields(
                MetricField.IMPRESSIONS, "string_map_data.Impressions.value",
                MetricField.REACH, "string_map_data.Accounts reached.value",
                MetricField.LIKES, "string_map_data.Likes.value",
                MetricField.COMMENTS, "string_map_data.Comments.value",
                MetricField.SHARES, "string_map_data.Shares.value");
        rules.add(hierarchical("posts", SourceKind.POSTS, "organic_insights_posts", mediaInsights));
        rules.add(hierarchical("reels", SourceKind.POSTS, "organic_insights_reels", mediaInsights));
        rules.add(hierarchical("profiles_reached", SourceKind.REACH, null, Map.of()));
        rules.add(hierarchical("content_interactions", SourceKind.CONTENT, null, Map.of()));
        rules.add(hierarchical("audience", SourceKind.AUDIENCE, null, Map.of()));
        rules.add(hierarchical("live_videos", SourceKind.OTHER, null, Map.of()));

        return rules;
    }

    private static Rule tabular(String pattern, SourceKind kind, String timeKey, String dateFormat,
                                AggregationLevel level, Map<MetricField, String> fieldPaths) {
        return new Rule(pattern, SourceFamily.TABULAR, kind, timeKey, dateFormat, null, level, fieldPaths);
    }

    private static Rule hierarchical(String pattern, SourceKind kind, String recordsPath,
                                     Map<MetricField, String> fieldPaths) {
        String timeKey = fieldPaths.isEmpty() ? null : "string_map_data.Creation timestamp.timestamp";
        return new Rule(pattern, SourceFamily.HIERARCHICAL, kind, timeKey, null, recordsPath,
                AggregationLevel.PER_ROW, fieldPaths);
    }

    private static Map<MetricField, String> fields(Object... pairs) {
        Map<MetricField, String> map = new EnumMap<>(MetricField.class);
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((MetricField) pairs[i], (String) pairs[i + 1]);
        }
        return map;
    }
}
