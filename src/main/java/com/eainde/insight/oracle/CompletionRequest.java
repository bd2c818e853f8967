package com.eainde.insight.oracle;

import java.time.Duration;
import java.util.Objects;

/**
 * One prompt for the completion capability.
 *
 * @param purpose      call category used for usage accounting, e.g. {@code schema_discovery}
 * @param systemPrompt instructions
 * @param userPrompt   data and question
 * @param maxTokens    output token cap
 * @param timeout      hard wall-clock limit for the call
 * @param wantJson     request a JSON object response
 */
public record CompletionRequest(
        String purpose,
        String systemPrompt,
        String userPrompt,
        int maxTokens,
        Duration timeout,
        boolean wantJson
) {

    public CompletionRequest {
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(userPrompt, "userPrompt");
        Objects.requireNonNull(timeout, "timeout");
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
    }

    public static CompletionRequest json(String purpose, String systemPrompt, String userPrompt,
                                         int maxTokens, Duration timeout) {
        return new CompletionRequest(purpose, systemPrompt, userPrompt, maxTokens, timeout, true);
    }
}
