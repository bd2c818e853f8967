package com.eainde.insight.oracle;

import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;

/**
 * Raw answer of the completion capability.
 */
public record Completion(String text, FinishReason finishReason, TokenUsage tokenUsage) {

    public Completion {
        text = text == null ? "" : text;
    }

    public static Completion of(String text) {
        return new Completion(text, FinishReason.STOP, null);
    }

    /** True when the model stopped because it hit the output token cap. */
    public boolean isTruncated() {
        return finishReason == FinishReason.LENGTH;
    }
}
