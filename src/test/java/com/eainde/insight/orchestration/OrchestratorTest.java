package com.eainde.insight.orchestration;

import com.eainde.insight.analysis.AnalysisTask;
import com.eainde.insight.analysis.SeriesFixtures;
import com.eainde.insight.analysis.SynthesisTask;
import com.eainde.insight.ingestion.IngestionPipeline;
import com.eainde.insight.ingestion.PipelineFatalException;
import com.eainde.insight.ingestion.SourceFile;
import com.eainde.insight.model.Confidence;
import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.SkipReason;
import com.eainde.insight.model.SkippedFile;
import com.eainde.insight.model.UnifiedStore;
import com.eainde.insight.oracle.UsageTracker;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrchestratorTest {

    private static final Map<SourceFamily, List<SourceFile>> NO_FILES = Map.of();

    @Mock
    private IngestionPipeline ingestionPipeline;

    @Mock
    private SynthesisTask synthesisTask;

    private ExecutorService pool;
    private UnifiedStore store;

    /** Analysis stub whose behaviour is supplied per test. */
    private record StubTask(Platform platform, Function<UnifiedStore, List<Finding>> body) implements AnalysisTask {
        @Override
        public List<Finding> analyze(UnifiedStore store) {
            return body.apply(store);
        }
    }

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(3);
        store = SeriesFixtures.sealedStore(SeriesFixtures.linkedin(14), SeriesFixtures.website(14));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        pool.shutdownNow();
        pool.awaitTermination(5, TimeUnit.SECONDS);
    }

    private Orchestrator orchestrator(RunListener listener, AnalysisTask... tasks) {
        return new Orchestrator(ingestionPipeline, List.of(tasks), synthesisTask,
                new MdcAwareExecutor(pool), new UsageTracker(), listener);
    }

    private static StubTask returning(Platform platform, Finding... findings) {
        return new StubTask(platform, s -> List.of(findings));
    }

    private static Finding finding(String title) {
        return new Finding(title, "summary", "impressions", "", Confidence.LOW, List.of(), "act");
    }

    @Nested
    @DisplayName("Partial failures")
    class PartialFailures {

        @Test
        @DisplayName("one failing analysis should not stop the others or synthesis")
        @SuppressWarnings("unchecked")
        void oneAnalysisFails() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            when(synthesisTask.synthesize(eq(store), any())).thenReturn(List.of(finding("Cross-Platform Growth Trend")));
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP,
                    returning(Platform.LINKEDIN, finding("LinkedIn: Impressions Trend")),
                    new StubTask(Platform.INSTAGRAM, s -> {
                        throw new IllegalStateException("instagram exploded");
                    }),
                    returning(Platform.WEBSITE, finding("Website: Page views Trend")));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.INGESTION)).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(report.getStatus("analysis:linkedin")).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(report.getStatus("analysis:website")).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(report.getStatus("analysis:instagram")).isEqualTo(TaskStatus.FAILED);
            assertThat(report.getTaskResult("analysis:instagram").getError())
                    .hasValueSatisfying(e -> assertThat(e).contains("instagram exploded"));
            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(report.getFindings(Platform.INSTAGRAM)).isEmpty();
            assertThat(report.getSynthesisFindings()).hasSize(1);
            assertThat(report.isComplete()).isFalse();

            ArgumentCaptor<Map<Platform, List<Finding>>> captor = ArgumentCaptor.forClass(Map.class);
            verify(synthesisTask).synthesize(eq(store), captor.capture());
            assertThat(captor.getValue()).containsOnlyKeys(Platform.LINKEDIN, Platform.WEBSITE);
        }

        @Test
        @DisplayName("a failing synthesis should keep the platform findings")
        void synthesisFails() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            when(synthesisTask.synthesize(eq(store), any())).thenThrow(new IllegalArgumentException("bad input"));
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP,
                    returning(Platform.LINKEDIN, finding("LinkedIn: Impressions Trend")));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.FAILED);
            assertThat(report.getFindings(Platform.LINKEDIN)).extracting(Finding::title)
                    .containsExactly("LinkedIn: Impressions Trend");
            assertThat(report.getSynthesisFindings()).isEmpty();
        }

        @Test
        @DisplayName("synthesis is skipped when no analysis produced findings")
        void noFindingsSkipsSynthesis() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP,
                    returning(Platform.LINKEDIN), returning(Platform.WEBSITE));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus("analysis:linkedin")).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.SKIPPED);
            verifyNoInteractions(synthesisTask);
        }
    }

    @Nested
    @DisplayName("Ingestion failures")
    class IngestionFailures {

        @Test
        @DisplayName("no input files should fail ingestion and skip everything else")
        void fatal() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenThrow(new PipelineFatalException("No input files supplied"));
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP,
                    returning(Platform.LINKEDIN, finding("never")), returning(Platform.WEBSITE, finding("never")));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.INGESTION)).isEqualTo(TaskStatus.FAILED);
            assertThat(report.getTaskResult(Orchestrator.INGESTION).getError()).contains("No input files supplied");
            assertThat(report.getStatus("analysis:linkedin")).isEqualTo(TaskStatus.SKIPPED);
            assertThat(report.getStatus("analysis:website")).isEqualTo(TaskStatus.SKIPPED);
            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.SKIPPED);
            assertThat(report.getStore().isEmpty()).isTrue();
            verifyNoInteractions(synthesisTask);
        }

        @Test
        @DisplayName("a store without records should fail ingestion but keep the skip list")
        void emptyStore() throws Exception {
            UnifiedStore empty = new UnifiedStore();
            empty.recordSkip(new SkippedFile("audience.json", SkipReason.UNMAPPABLE, "no time series"));
            empty.seal();
            when(ingestionPipeline.run(NO_FILES)).thenReturn(empty);
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP, returning(Platform.LINKEDIN, finding("never")));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.INGESTION)).isEqualTo(TaskStatus.FAILED);
            assertThat(report.getTaskResult(Orchestrator.INGESTION).getError())
                    .hasValueSatisfying(e -> assertThat(e).contains("1 file(s) skipped"));
            assertThat(report.getStatus("analysis:linkedin")).isEqualTo(TaskStatus.SKIPPED);
            assertThat(report.getStore().skippedFiles()).extracting(SkippedFile::fileName).containsExactly("audience.json");
        }

        @Test
        @DisplayName("an unexpected ingestion error should be reported, not thrown")
        void unexpected() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenThrow(new IllegalStateException("disk gone"));
            Orchestrator orchestrator = orchestrator(RunListener.NO_OP, returning(Platform.WEBSITE));

            RunReport report = orchestrator.execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.INGESTION)).isEqualTo(TaskStatus.FAILED);
            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.SKIPPED);
        }
    }

    @Nested
    @DisplayName("Run plumbing")
    class Plumbing {

        @Test
        @DisplayName("a throwing listener should not break the run")
        void listenerFailure() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            when(synthesisTask.synthesize(eq(store), any())).thenReturn(List.of());
            List<TaskResult<?>> updates = new CopyOnWriteArrayList<>();
            RunListener listener = result -> {
                updates.add(result);
                throw new IllegalStateException("display closed");
            };

            RunReport report = orchestrator(listener, returning(Platform.LINKEDIN, finding("x"))).execute(NO_FILES);

            assertThat(report.getStatus(Orchestrator.SYNTHESIS)).isEqualTo(TaskStatus.SUCCEEDED);
            assertThat(updates).extracting(TaskResult::getStatus)
                    .contains(TaskStatus.RUNNING, TaskStatus.SUCCEEDED)
                    .doesNotContain(TaskStatus.FAILED);
        }

        @Test
        @DisplayName("workers should log under the run id")
        void runIdPropagates() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            List<String> seen = new CopyOnWriteArrayList<>();
            StubTask task = new StubTask(Platform.LINKEDIN, s -> {
                seen.add(String.valueOf(MDC.get(Orchestrator.RUN_ID_KEY)));
                return List.of();
            });

            RunReport report = orchestrator(RunListener.NO_OP, task).execute(NO_FILES);

            assertThat(seen).containsExactly(report.getRunId());
            assertThat(MDC.get(Orchestrator.RUN_ID_KEY)).isNull();
        }

        @Test
        @DisplayName("task results are reported in execution order")
        void order() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            RunReport report = orchestrator(RunListener.NO_OP, returning(Platform.WEBSITE), returning(Platform.LINKEDIN))
                    .execute(NO_FILES);

            assertThat(report.getTaskResults().keySet())
                    .containsExactly(Orchestrator.INGESTION, "analysis:website", "analysis:linkedin", Orchestrator.SYNTHESIS);
        }

        @Test
        void duplicateTaskNames() {
            assertThatThrownBy(() -> orchestrator(RunListener.NO_OP,
                    returning(Platform.LINKEDIN), returning(Platform.LINKEDIN)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("analysis:linkedin");
        }

        @Test
        void unknownTaskName() throws Exception {
            when(ingestionPipeline.run(NO_FILES)).thenReturn(store);
            RunReport report = orchestrator(RunListener.NO_OP, returning(Platform.LINKEDIN)).execute(NO_FILES);

            assertThatThrownBy(() -> report.getTaskResult("analysis:tiktok")).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
