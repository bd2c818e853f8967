package com.eainde.insight.oracle;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.Platform;
import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.MappingOrigin;
import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.schema.SourceKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.output.FinishReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SchemaOracleTest {

    private static final Sample CONTENT_SAMPLE = new Sample(
            "linkedin_content.csv",
            SourceFamily.TABULAR,
            List.of("Date", "Impressions (total)", "Clicks (total)"),
            List.of(Map.of("Date", "01/15/2024", "Impressions (total)", "1,200", "Clicks (total)", "35")));

    @Mock
    private CompletionClient completionClient;

    private SchemaOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new SchemaOracle(completionClient, new ObjectMapper(), Duration.ofSeconds(30), 1024);
    }

    // =========================================================================
    //  Well-formed answers
    // =========================================================================

    @Nested
    @DisplayName("Well-formed answer")
    class WellFormed {

        @Test
        @DisplayName("should build an ORACLE mapping from the JSON answer")
        void mapsAnswer() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of("""
                    {"sourceKind":"content","timeKeyPath":"Date","dateFormat":"MM/dd/yyyy",
                     "recordsPath":null,"aggregationLevel":"per_row",
                     "mappings":{"impressions":"Impressions (total)","clicks":"Clicks (total)"}}"""));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getSourceKind()).isEqualTo(SourceKind.CONTENT);
            assertThat(mapping.getTimeKeyPath()).isEqualTo("Date");
            assertThat(mapping.getDateFormat()).isEqualTo("MM/dd/yyyy");
            assertThat(mapping.getRecordsPath()).isNull();
            assertThat(mapping.getAggregationLevel()).isEqualTo(AggregationLevel.PER_ROW);
            assertThat(mapping.getOrigin()).isEqualTo(MappingOrigin.ORACLE);
            assertThat(mapping.getFieldPaths()).containsExactlyInAnyOrderEntriesOf(Map.of(
                    MetricField.IMPRESSIONS, "Impressions (total)",
                    MetricField.CLICKS, "Clicks (total)"));
        }

        @Test
        @DisplayName("should read the minimal answer with timeKeyPath and default to per-row")
        void minimalAnswer() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of(
                    "{\"sourceKind\":\"content\",\"timeKeyPath\":\"Date\",\"mappings\":"
                            + "{\"impressions\":\"Impressions (total)\",\"clicks\":\"Clicks (total)\"}}"));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getTimeKeyPath()).isEqualTo("Date");
            assertThat(mapping.getAggregationLevel()).isEqualTo(AggregationLevel.PER_ROW);
            assertThat(mapping.getFieldPaths()).containsOnlyKeys(MetricField.IMPRESSIONS, MetricField.CLICKS);
        }

        @Test
        @DisplayName("should accept the short timeKey and aggregation keys")
        void shortKeys() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of(
                    "{\"sourceKind\":\"traffic\",\"timeKey\":\"Day\",\"aggregation\":\"pre_aggregated\","
                            + "\"mappings\":{\"impressions\":\"Impressions (total)\"}}"));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getTimeKeyPath()).isEqualTo("Day");
            assertThat(mapping.getAggregationLevel()).isEqualTo(AggregationLevel.PRE_AGGREGATED);
        }

        @Test
        @DisplayName("should accept a fenced answer and ignore unknown canonical keys")
        void fencedAndUnknownKeys() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of("""
                    ```json
                    {"sourceKind":"content","timeKeyPath":"Date","mappings":{"impressions":"Impressions (total)","virality":"Clicks (total)"}}
                    ```"""));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getFieldPaths()).containsOnlyKeys(MetricField.IMPRESSIONS);
        }

        @Test
        @DisplayName("should classify an unknown kind as UNCLASSIFIED")
        void unknownKind() throws Exception {
            when(completionClient.complete(any())).thenReturn(
                    Completion.of("{\"sourceKind\":\"podcast\",\"mappings\":{}}"));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getSourceKind()).isEqualTo(SourceKind.UNCLASSIFIED);
            assertThat(mapping.hasFieldPaths()).isFalse();
        }

        @Test
        @DisplayName("should send field names, sample rows and candidate fields in a bounded JSON request")
        void promptContents() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of("{\"mappings\":{}}"));

            oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
            verify(completionClient).complete(captor.capture());
            CompletionRequest request = captor.getValue();
            assertThat(request.purpose()).isEqualTo(SchemaOracle.PURPOSE);
            assertThat(request.wantJson()).isTrue();
            assertThat(request.maxTokens()).isEqualTo(1024);
            assertThat(request.userPrompt())
                    .contains("linkedin_content.csv")
                    .contains("Impressions (total)")
                    .contains("01/15/2024")
                    .contains(MetricField.ENGAGEMENT_RATE.key())
                    .doesNotContain(MetricField.BOUNCE_RATE.key());
        }
    }

    // =========================================================================
    //  Truncated and invalid answers
    // =========================================================================

    @Nested
    @DisplayName("Truncated or invalid answer")
    class Invalid {

        @Test
        @DisplayName("should repair an answer cut off by the token cap")
        void repairsTruncated() throws Exception {
            when(completionClient.complete(any())).thenReturn(new Completion(
                    "{\"sourceKind\":\"content\",\"mappings\":{\"impressions\":\"Impressions (total)\",\"clicks\":\"Cli",
                    FinishReason.LENGTH, null));

            SchemaMapping mapping = oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields());

            assertThat(mapping.getSourceKind()).isEqualTo(SourceKind.CONTENT);
            assertThat(mapping.getFieldPaths()).containsOnlyKeys(MetricField.IMPRESSIONS);
        }

        @Test
        @DisplayName("should reject prose that is not JSON")
        void garbage() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of("I think this is a content export."));

            assertThatThrownBy(() -> oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields()))
                    .isInstanceOf(OracleInvalidResponseException.class);
        }

        @Test
        @DisplayName("should reject an answer without a mappings object")
        void missingMappings() throws Exception {
            when(completionClient.complete(any())).thenReturn(Completion.of("{\"sourceKind\":\"content\"}"));

            assertThatThrownBy(() -> oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields()))
                    .isInstanceOf(OracleInvalidResponseException.class)
                    .hasMessageContaining("mappings");
        }

        @Test
        @DisplayName("should propagate an unavailable completion client")
        void unavailable() throws Exception {
            when(completionClient.complete(any())).thenThrow(new OracleUnavailableException("timed out"));

            assertThatThrownBy(() -> oracle.discover(CONTENT_SAMPLE, Platform.LINKEDIN.metricFields()))
                    .isInstanceOf(OracleUnavailableException.class);
        }
    }
}
