package com.eainde.insight.oracle;

import java.util.Map;

/**
 * Snapshot of LLM usage, overall and per call purpose.
 */
public record UsageSummary(
        int totalCalls,
        long inputTokens,
        long outputTokens,
        Map<String, PurposeUsage> byPurpose
) {

    public UsageSummary {
        byPurpose = Map.copyOf(byPurpose);
    }

    public static UsageSummary empty() {
        return new UsageSummary(0, 0, 0, Map.of());
    }

    public long totalTokens() {
        return inputTokens + outputTokens;
    }

    public record PurposeUsage(int calls, long inputTokens, long outputTokens) {

        public long totalTokens() {
            return inputTokens + outputTokens;
        }
    }
}
