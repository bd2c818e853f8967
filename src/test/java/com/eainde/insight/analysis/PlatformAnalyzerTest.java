package com.eainde.insight.analysis;

import com.eainde.insight.model.Confidence;
import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.UnifiedStore;
import com.eainde.insight.oracle.Completion;
import com.eainde.insight.oracle.CompletionClient;
import com.eainde.insight.oracle.CompletionRequest;
import com.eainde.insight.oracle.OracleUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PlatformAnalyzerTest {

    @Mock
    private CompletionClient completionClient;

    private NarrativeWriter narrativeWriter;

    @BeforeEach
    void setUp() {
        narrativeWriter = new NarrativeWriter(completionClient, new ObjectMapper(), Duration.ofSeconds(10), 400);
    }

    @Test
    @DisplayName("task name should be derived from the platform")
    void name() {
        assertThat(new PlatformAnalyzer(PlatformProfile.website(), narrativeWriter).name()).isEqualTo("analysis:website");
    }

    @Test
    @DisplayName("too few records should yield no findings and no oracle calls")
    void tooFewRecords() {
        UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.linkedin(6));

        List<Finding> findings = new PlatformAnalyzer(PlatformProfile.linkedin(), narrativeWriter).analyze(store);

        assertThat(findings).isEmpty();
        verifyNoInteractions(completionClient);
    }

    @Test
    @DisplayName("should only read its own platform")
    void ignoresOtherPlatforms() {
        UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.linkedin(60));

        assertThat(new PlatformAnalyzer(PlatformProfile.instagram(), narrativeWriter).analyze(store)).isEmpty();
    }

    // =========================================================================
    //  Statistical fallback
    // =========================================================================

    @Nested
    @DisplayName("Oracle unavailable")
    class Fallback {

        @BeforeEach
        void oracleDown() throws Exception {
            when(completionClient.complete(any())).thenThrow(new OracleUnavailableException("down"));
        }

        @Test
        @DisplayName("sixty LinkedIn days should produce all four findings from statistics alone")
        void linkedinFullHistory() {
            UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.linkedin(60));

            List<Finding> findings = new PlatformAnalyzer(PlatformProfile.linkedin(), narrativeWriter).analyze(store);

            assertThat(findings).extracting(Finding::title).containsExactly(
                    "LinkedIn: Impressions Trend",
                    "LinkedIn: Reactions per impression",
                    "LinkedIn: Activity Cadence",
                    "LinkedIn: Engagement rate Distribution");
            Finding trend = findings.get(0);
            assertThat(trend.summary()).contains("rose").contains("26.2%");
            assertThat(trend.confidence()).isEqualTo(Confidence.HIGH);
            assertThat(trend.timeRange()).isEqualTo("2024-01-31 to 2024-02-29");
            assertThat(findings).allSatisfy(f -> {
                assertThat(f.evidence()).isNotEmpty();
                assertThat(f.recommendation()).isNotBlank();
            });
        }

        @Test
        @DisplayName("a short history should yield a low-confidence trend without comparison")
        void shortHistory() {
            UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.linkedin(10));

            List<Finding> findings = new PlatformAnalyzer(PlatformProfile.linkedin(), narrativeWriter).analyze(store);

            assertThat(findings).extracting(Finding::title)
                    .containsExactly("LinkedIn: Impressions Trend", "LinkedIn: Engagement rate Distribution");
            assertThat(findings.get(0).confidence()).isEqualTo(Confidence.LOW);
            assertThat(findings.get(0).summary()).contains("not enough history");
        }

        @Test
        @DisplayName("website analysis should treat a high bounce rate as bad")
        void websiteBounce() {
            UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.website(60));

            List<Finding> findings = new PlatformAnalyzer(PlatformProfile.website(), narrativeWriter).analyze(store);

            Finding distribution = findings.stream()
                    .filter(f -> f.title().equals("Website: Bounce rate Distribution"))
                    .findFirst().orElseThrow();
            assertThat(distribution.summary()).startsWith("0% of days met");
            assertThat(distribution.recommendation()).startsWith("Fewer than half");
            assertThat(findings.get(0).summary()).contains("fell");
        }
    }

    // =========================================================================
    //  Narrated
    // =========================================================================

    @Test
    @DisplayName("should use the oracle narrative and keep the statistical evidence")
    void narrated() throws Exception {
        when(completionClient.complete(any())).thenReturn(Completion.of(
                "{\"summary\":\"Narrated summary.\",\"recommendation\":\"Narrated action.\"}"));
        UnifiedStore store = SeriesFixtures.sealedStore(SeriesFixtures.instagram(60));

        List<Finding> findings = new PlatformAnalyzer(PlatformProfile.instagram(), narrativeWriter).analyze(store);

        assertThat(findings).isNotEmpty().allSatisfy(f -> {
            assertThat(f.summary()).isEqualTo("Narrated summary.");
            assertThat(f.recommendation()).isEqualTo("Narrated action.");
            assertThat(f.evidence()).isNotEmpty();
            assertThat(f.title()).startsWith(Platform.INSTAGRAM.displayName());
        });
        ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient, atLeastOnce()).complete(captor.capture());
        assertThat(captor.getAllValues()).allSatisfy(r -> {
            assertThat(r.purpose()).isEqualTo(NarrativeWriter.PURPOSE_INSIGHT);
            assertThat(r.systemPrompt()).contains("Instagram");
        });
    }
}
