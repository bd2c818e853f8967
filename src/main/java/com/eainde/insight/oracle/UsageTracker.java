package com.eainde.insight.oracle;

import dev.langchain4j.model.output.TokenUsage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thread-safe accumulator of completion calls and token counts per call purpose.
 * Calls that fail before the model answers are not counted.
 */
public class UsageTracker {

    private final Map<String, long[]> byPurpose = new LinkedHashMap<>();

    public synchronized void record(String purpose, TokenUsage usage) {
        long[] totals = byPurpose.computeIfAbsent(purpose, p -> new long[3]);
        totals[0]++;
        if (usage != null) {
            totals[1] += usage.inputTokenCount() == null ? 0 : usage.inputTokenCount();
            totals[2] += usage.outputTokenCount() == null ? 0 : usage.outputTokenCount();
        }
    }

    public synchronized UsageSummary summary() {
        Map<String, UsageSummary.PurposeUsage> purposes = new LinkedHashMap<>();
        int calls = 0;
        long input = 0;
        long output = 0;
        for (Map.Entry<String, long[]> entry : byPurpose.entrySet()) {
            long[] t = entry.getValue();
            purposes.put(entry.getKey(), new UsageSummary.PurposeUsage((int) t[0], t[1], t[2]));
            calls += (int) t[0];
            input += t[1];
            output += t[2];
        }
        return new UsageSummary(calls, input, output, purposes);
    }

    public synchronized void reset() {
        byPurpose.clear();
    }
}
