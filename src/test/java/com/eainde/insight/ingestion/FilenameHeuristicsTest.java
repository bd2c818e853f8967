package com.eainde.insight.ingestion;

import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.MappingOrigin;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.schema.SourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FilenameHeuristicsTest {

    private final FilenameHeuristics heuristics = FilenameHeuristics.defaults();

    @Test
    @DisplayName("should match case-insensitively within the file's family")
    void matchesByFamily() {
        assertThat(heuristics.match("LinkedIn_Followers_2024.csv", SourceFamily.TABULAR))
                .hasValueSatisfying(rule -> assertThat(rule.kind()).isEqualTo(SourceKind.FOLLOWERS));
        assertThat(heuristics.match("followers.csv", SourceFamily.HIERARCHICAL)).isEmpty();
    }

    @Test
    @DisplayName("should flag traffic summaries as pre-aggregated")
    void trafficIsPreAggregated() {
        assertThat(heuristics.match("site_traffic.csv", SourceFamily.TABULAR))
                .hasValueSatisfying(rule -> assertThat(rule.aggregationLevel()).isEqualTo(AggregationLevel.PRE_AGGREGATED));
    }

    @Test
    @DisplayName("should build HEURISTIC mappings")
    void toMapping() {
        FilenameHeuristics.Rule rule = heuristics.match("posts.json", SourceFamily.HIERARCHICAL).orElseThrow();

        assertThat(rule.isMappable()).isTrue();
        assertThat(rule.toMapping().getOrigin()).isEqualTo(MappingOrigin.HEURISTIC);
        assertThat(rule.toMapping().getRecordsPath()).isEqualTo("organic_insights_posts");
    }

    @Test
    @DisplayName("should leave unknown names unmatched")
    void unknown() {
        assertThat(heuristics.match("random.csv", SourceFamily.TABULAR)).isEmpty();
    }
}
