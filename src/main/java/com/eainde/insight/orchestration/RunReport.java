package com.eainde.insight.orchestration;

import com.eainde.insight.model.Finding;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.UnifiedStore;
import com.eainde.insight.oracle.UsageSummary;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one orchestrator run produced. Partial runs are normal: platform lists are empty
 * for analyses that did not succeed and synthesis findings are empty when synthesis was
 * skipped or failed.
 */
public final class RunReport {

    private final String runId;
    private final UnifiedStore store;
    private final Map<Platform, List<Finding>> platformFindings;
    private final List<Finding> synthesisFindings;
    private final Map<String, TaskResult<?>> taskResults;
    private final UsageSummary usage;

    RunReport(String runId, UnifiedStore store, Map<Platform, List<Finding>> platformFindings,
              List<Finding> synthesisFindings, Map<String, TaskResult<?>> taskResults, UsageSummary usage) {
        this.runId = runId;
        this.store = store;
        Map<Platform, List<Finding>> findings = new EnumMap<>(Platform.class);
        platformFindings.forEach((platform, list) -> findings.put(platform, List.copyOf(list)));
        this.platformFindings = Collections.unmodifiableMap(findings);
        this.synthesisFindings = List.copyOf(synthesisFindings);
        this.taskResults = Collections.unmodifiableMap(new LinkedHashMap<>(taskResults));
        this.usage = usage;
    }

    public String getRunId() {
        return runId;
    }

    /** Sealed store; empty when ingestion failed. */
    public UnifiedStore getStore() {
        return store;
    }

    public Map<Platform, List<Finding>> getPlatformFindings() {
        return platformFindings;
    }

    public List<Finding> getFindings(Platform platform) {
        return platformFindings.getOrDefault(platform, List.of());
    }

    public List<Finding> getSynthesisFindings() {
        return synthesisFindings;
    }

    /** Task results in execution order: ingestion, analyses, synthesis. */
    public Map<String, TaskResult<?>> getTaskResults() {
        return taskResults;
    }

    public TaskResult<?> getTaskResult(String name) {
        TaskResult<?> result = taskResults.get(name);
        if (result == null) {
            throw new IllegalArgumentException("No task named '" + name + "' in run " + runId);
        }
        return result;
    }

    public TaskStatus getStatus(String name) {
        return getTaskResult(name).getStatus();
    }

    public UsageSummary getUsage() {
        return usage;
    }

    public boolean isComplete() {
        return taskResults.values().stream().allMatch(TaskResult::isSucceeded);
    }
}
