package com.eainde.insight.orchestration;

import com.eainde.insight.analysis.AnalysisTask;
import com.eainde.insight.analysis.SynthesisTask;
import com.eainde.insight.ingestion.IngestionPipeline;
import com.eainde.insight.ingestion.PipelineFatalException;
import com.eainde.insight.ingestion.SourceFile;
import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.UnifiedStore;
import com.eainde.insight.oracle.UsageTracker;
import com.eainde.insight.schema.SourceFamily;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one analysis end to end and always returns a {@link RunReport}, however much of the run
 * failed.
 *
 * <h3>Phases:</h3>
 * <pre>
 * 1. INGESTION   (calling thread)
 *      IngestionPipeline.run → sealed UnifiedStore
 *      failed (no files / no records / error) → every later task SKIPPED, report returned
 *
 * 2. ANALYSIS    (bounded pool, one unit per platform)
 *      AnalysisTask.analyze(store) → findings
 *      a throwing task is FAILED on its own; the others keep running; wait for all
 *
 * 3. SYNTHESIS   (calling thread)
 *      ≥1 analysis SUCCEEDED with findings → SynthesisTask.synthesize
 *      otherwise SKIPPED; a failure keeps the platform findings
 * </pre>
 *
 * <p>The store is sealed before phase 2 and each analysis writes only its own result, so the
 * fan-out needs no locking beyond the result map. A run id is placed in the MDC and travels to
 * the workers with the executor.
 */
@Log4j2
public class Orchestrator {

    public static final String INGESTION = "ingestion";
    public static final String SYNTHESIS = SynthesisTask.NAME;
    public static final String RUN_ID_KEY = "runId";

    private final IngestionPipeline ingestionPipeline;
    private final List<AnalysisTask> analysisTasks;
    private final SynthesisTask synthesisTask;
    private final Executor analysisExecutor;
    private final UsageTracker usageTracker;
    private final RunListener listener;

    public Orchestrator(IngestionPipeline ingestionPipeline,
                        List<? extends AnalysisTask> analysisTasks,
                        SynthesisTask synthesisTask,
                        Executor analysisExecutor,
                        UsageTracker usageTracker,
                        RunListener listener) {
        this.ingestionPipeline = ingestionPipeline;
        this.analysisTasks = List.copyOf(analysisTasks);
        this.synthesisTask = synthesisTask;
        this.analysisExecutor = analysisExecutor;
        this.usageTracker = usageTracker;
        this.listener = listener != null ? listener : RunListener.NO_OP;

        Set<String> names = new HashSet<>();
        for (AnalysisTask task : this.analysisTasks) {
            if (!names.add(task.name())) {
                throw new IllegalArgumentException("Duplicate analysis task name: " + task.name());
            }
        }
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Executes ingestion, parallel platform analysis and synthesis.
     *
     * @param fileSets discovered source files per family
     * @return the report; never null, never thrown away on partial failure
     */
    public RunReport execute(Map<SourceFamily, List<SourceFile>> fileSets) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_KEY, runId);
        long start = System.currentTimeMillis();
        try {
            RunReport report = run(runId, fileSets);
            log.info("Run {} finished in {}ms: {}", runId, System.currentTimeMillis() - start,
                    report.getTaskResults().values());
            return report;
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private RunReport run(String runId, Map<SourceFamily, List<SourceFile>> fileSets) {
        Map<String, TaskResult<?>> results = Collections.synchronizedMap(new LinkedHashMap<>());
        results.put(INGESTION, TaskResult.pending(INGESTION));
        analysisTasks.forEach(task -> results.put(task.name(), TaskResult.pending(task.name())));
        results.put(SYNTHESIS, TaskResult.pending(SYNTHESIS));

        // ── PHASE 1: Ingestion ──────────────────────────────────────────
        Ingestion ingestion = runIngestion(fileSets, results);
        UnifiedStore store = ingestion.store();
        if (!ingestion.result().isSucceeded()) {
            String reason = "ingestion failed: " + ingestion.result().getError().orElse("unknown");
            analysisTasks.forEach(task -> skip(task.name(), reason, results));
            skip(SYNTHESIS, reason, results);
            return report(runId, store, new EnumMap<>(Platform.class), List.of(), results);
        }

        // ── PHASE 2: Platform analysis (parallel) ───────────────────────
        Map<AnalysisTask, TaskResult<List<Finding>>> analyses = runAnalyses(store, results);

        Map<Platform, List<Finding>> platformFindings = new EnumMap<>(Platform.class);
        Map<Platform, List<Finding>> successful = new EnumMap<>(Platform.class);
        analyses.forEach((task, result) -> {
            List<Finding> findings = result.getPayload().orElse(List.of());
            platformFindings.put(task.platform(), findings);
            if (result.isSucceeded()) {
                successful.put(task.platform(), findings);
            }
        });

        // ── PHASE 3: Synthesis ──────────────────────────────────────────
        boolean anyFindings = successful.values().stream().anyMatch(f -> !f.isEmpty());
        List<Finding> synthesisFindings = List.of();
        if (!anyFindings) {
            skip(SYNTHESIS, "no platform analysis produced findings", results);
        } else {
            TaskResult<List<Finding>> synthesis = publish(TaskResult.<List<Finding>>pending(SYNTHESIS).start(), results);
            try {
                synthesisFindings = synthesisTask.synthesize(store, successful);
                publish(synthesis.succeed(synthesisFindings), results);
            } catch (RuntimeException e) {
                log.error("Synthesis failed; keeping platform findings", e);
                publish(synthesis.fail(e), results);
            }
        }

        return report(runId, store, platformFindings, synthesisFindings, results);
    }

    // =========================================================================
    //  Phases
    // =========================================================================

    /** Ingestion outcome; the store is the sealed (possibly empty) store even when the task failed. */
    private record Ingestion(TaskResult<UnifiedStore> result, UnifiedStore store) {
    }

    private Ingestion runIngestion(Map<SourceFamily, List<SourceFile>> fileSets,
                                   Map<String, TaskResult<?>> results) {
        TaskResult<UnifiedStore> running = publish(TaskResult.<UnifiedStore>pending(INGESTION).start(), results);
        try {
            UnifiedStore store = ingestionPipeline.run(fileSets);
            if (store.isEmpty()) {
                log.error("Ingestion loaded no records; {} file(s) skipped", store.skippedFiles().size());
                return new Ingestion(publish(running.fail(
                        "no records loaded; " + store.skippedFiles().size() + " file(s) skipped"), results), store);
            }
            return new Ingestion(publish(running.succeed(store), results), store);
        } catch (PipelineFatalException e) {
            log.error("Ingestion aborted: {}", e.getMessage());
            return new Ingestion(publish(running.fail(e.getMessage()), results), UnifiedStore.empty());
        } catch (RuntimeException e) {
            log.error("Ingestion failed unexpectedly", e);
            return new Ingestion(publish(running.fail(e), results), UnifiedStore.empty());
        }
    }

    private Map<AnalysisTask, TaskResult<List<Finding>>> runAnalyses(UnifiedStore store,
                                                                     Map<String, TaskResult<?>> results) {
        Map<AnalysisTask, CompletableFuture<TaskResult<List<Finding>>>> futures = new LinkedHashMap<>();
        for (AnalysisTask task : analysisTasks) {
            CompletableFuture<TaskResult<List<Finding>>> future;
            try {
                future = CompletableFuture.supplyAsync(() -> runAnalysis(task, store, results), analysisExecutor);
            } catch (RejectedExecutionException e) {
                log.error("Analysis task {} could not be scheduled", task.name(), e);
                future = CompletableFuture.completedFuture(
                        publish(TaskResult.<List<Finding>>pending(task.name()).start().fail(e), results));
            }
            futures.put(task, future.handle((result, error) -> error == null ? result
                    : publish(TaskResult.<List<Finding>>pending(task.name()).start().fail(unwrap(error)), results)));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();

        Map<AnalysisTask, TaskResult<List<Finding>>> analyses = new LinkedHashMap<>();
        futures.forEach((task, future) -> analyses.put(task, future.join()));
        long succeeded = analyses.values().stream().filter(TaskResult::isSucceeded).count();
        log.info("Analysis phase complete: {}/{} succeeded", succeeded, analyses.size());
        return analyses;
    }

    private TaskResult<List<Finding>> runAnalysis(AnalysisTask task, UnifiedStore store,
                                                  Map<String, TaskResult<?>> results) {
        TaskResult<List<Finding>> running = publish(TaskResult.<List<Finding>>pending(task.name()).start(), results);
        try {
            List<Finding> findings = task.analyze(store);
            return publish(running.succeed(findings == null ? List.of() : List.copyOf(findings)), results);
        } catch (RuntimeException e) {
            log.error("Analysis task {} failed", task.name(), e);
            return publish(running.fail(e), results);
        }
    }

    // =========================================================================
    //  Helpers
    // =========================================================================

    private void skip(String name, String reason, Map<String, TaskResult<?>> results) {
        publish(TaskResult.pending(name).skip(reason), results);
    }

    private <T> TaskResult<T> publish(TaskResult<T> result, Map<String, TaskResult<?>> results) {
        results.put(result.getName(), result);
        try {
            listener.onTaskUpdate(result);
        } catch (RuntimeException e) {
            log.warn("Run listener failed on {}: {}", result.getName(), e.getMessage());
        }
        return result;
    }

    private RunReport report(String runId, UnifiedStore store, Map<Platform, List<Finding>> platformFindings,
                             List<Finding> synthesisFindings, Map<String, TaskResult<?>> results) {
        Map<String, TaskResult<?>> snapshot;
        synchronized (results) {
            snapshot = new LinkedHashMap<>(results);
        }
        return new RunReport(runId, store, platformFindings, new ArrayList<>(synthesisFindings), snapshot,
                usageTracker.summary());
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
