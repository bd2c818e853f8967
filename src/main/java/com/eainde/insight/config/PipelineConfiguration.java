package com.eainde.insight.config;

import com.eainde.insight.analysis.NarrativeWriter;
import com.eainde.insight.analysis.PlatformAnalyzer;
import com.eainde.insight.analysis.PlatformProfile;
import com.eainde.insight.analysis.SynthesisTask;
import com.eainde.insight.ingestion.FilenameHeuristics;
import com.eainde.insight.ingestion.HierarchicalSourceLoader;
import com.eainde.insight.ingestion.IngestionPipeline;
import com.eainde.insight.ingestion.TabularSourceLoader;
import com.eainde.insight.oracle.SchemaOracle;
import com.eainde.insight.oracle.UsageTracker;
import com.eainde.insight.orchestration.Orchestrator;
import com.eainde.insight.orchestration.RunListener;
import com.eainde.insight.schema.SchemaCache;
import com.eainde.insight.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Ingestion, per-platform analysis and the orchestrator that runs them.
 *
 * <pre>
 *   IngestionPipeline (tabular + hierarchical loaders, schema oracle, schema cache)
 *        │
 *        ▼
 *   PlatformAnalyzer × 3  ── analysisExecutor (fixed, insight.analysis.parallelism)
 *        │
 *        ▼
 *   SynthesisTask
 * </pre>
 */
@Configuration
public class PipelineConfiguration {

    public static final String ANALYSIS_EXECUTOR = "analysisExecutor";

    // =========================================================================
    //  Ingestion
    // =========================================================================

    @Bean
    public FilenameHeuristics filenameHeuristics() {
        return FilenameHeuristics.defaults();
    }

    @Bean
    public TabularSourceLoader tabularSourceLoader(FilenameHeuristics heuristics) {
        return new TabularSourceLoader(heuristics);
    }

    @Bean
    public HierarchicalSourceLoader hierarchicalSourceLoader(FilenameHeuristics heuristics, ObjectMapper objectMapper) {
        return new HierarchicalSourceLoader(heuristics, objectMapper);
    }

    @Bean
    public IngestionPipeline ingestionPipeline(TabularSourceLoader tabular,
                                               HierarchicalSourceLoader hierarchical,
                                               SchemaOracle schemaOracle,
                                               SchemaCache schemaCache,
                                               InsightProperties properties) {
        return new IngestionPipeline(List.of(tabular, hierarchical), schemaOracle, schemaCache,
                properties.getIngestion().getAggregationPolicy(), properties.getOracle().getSampleRows());
    }

    // =========================================================================
    //  Analysis
    // =========================================================================

    @Bean
    public PlatformAnalyzer linkedinAnalyzer(InsightProperties properties, NarrativeWriter narrativeWriter) {
        return new PlatformAnalyzer(limited(PlatformProfile.linkedin(), properties), narrativeWriter);
    }

    @Bean
    public PlatformAnalyzer instagramAnalyzer(InsightProperties properties, NarrativeWriter narrativeWriter) {
        return new PlatformAnalyzer(limited(PlatformProfile.instagram(), properties), narrativeWriter);
    }

    @Bean
    public PlatformAnalyzer websiteAnalyzer(InsightProperties properties, NarrativeWriter narrativeWriter) {
        return new PlatformAnalyzer(limited(PlatformProfile.website(), properties), narrativeWriter);
    }

    @Bean
    public SynthesisTask synthesisTask(NarrativeWriter narrativeWriter, InsightProperties properties) {
        return new SynthesisTask(narrativeWriter, PlatformProfile.defaults().stream()
                .map(profile -> limited(profile, properties))
                .toList());
    }

    @Bean(name = ANALYSIS_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(InsightProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("analysis-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(1, properties.getAnalysis().getParallelism()), threadFactory);
    }

    private static PlatformProfile limited(PlatformProfile profile, InsightProperties properties) {
        InsightProperties.Analysis analysis = properties.getAnalysis();
        return profile.withLimits(analysis.getMinRecords(), analysis.getWindowDays());
    }

    // =========================================================================
    //  Orchestration
    // =========================================================================

    @Bean
    public Orchestrator orchestrator(IngestionPipeline ingestionPipeline,
                                     List<PlatformAnalyzer> platformAnalyzers,
                                     SynthesisTask synthesisTask,
                                     @Qualifier(ANALYSIS_EXECUTOR) ExecutorService analysisExecutor,
                                     UsageTracker usageTracker) {
        return new Orchestrator(ingestionPipeline, platformAnalyzers, synthesisTask,
                new MdcAwareExecutor(analysisExecutor), usageTracker, RunListener.NO_OP);
    }
}
