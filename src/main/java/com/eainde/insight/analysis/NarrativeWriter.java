package com.eainde.insight.analysis;

import com.eainde.insight.oracle.Completion;
import com.eainde.insight.oracle.CompletionClient;
import com.eainde.insight.oracle.CompletionRequest;
import com.eainde.insight.oracle.JsonRepair;
import com.eainde.insight.oracle.OracleException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Turns precomputed numeric facts into a short narrative and recommendation via the
 * completion capability. Returns empty whenever the capability is unavailable or its answer is
 * unusable, so callers can fall back to the statistical text.
 */
@Slf4j
public class NarrativeWriter {

    public static final String PURPOSE_INSIGHT = "insight_generation";
    public static final String PURPOSE_STRATEGY = "strategy";

    private static final String FORMAT_INSTRUCTION = """

            Use only the facts provided; never invent numbers. Respond with a JSON object:
            {"summary": "2-3 sentences interpreting the facts", "recommendation": "one concrete action"}""";

    public record Narrative(String summary, String recommendation) {
    }

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final int maxTokens;

    public NarrativeWriter(CompletionClient completionClient, ObjectMapper objectMapper,
                           Duration timeout, int maxTokens) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.maxTokens = maxTokens;
    }

    public Optional<Narrative> write(String purpose, String persona, String question, List<String> facts) {
        String prompt = "Question: " + question + "\n\nFacts:\n- " + String.join("\n- ", facts);
        Completion completion;
        try {
            completion = completionClient.complete(
                    CompletionRequest.json(purpose, persona + FORMAT_INSTRUCTION, prompt, maxTokens, timeout));
        } catch (OracleException e) {
            log.debug("[{}] narrative unavailable: {}", purpose, e.getMessage());
            return Optional.empty();
        }
        return parse(completion, purpose);
    }

    private Optional<Narrative> parse(Completion completion, String purpose) {
        String text = completion.isTruncated()
                ? JsonRepair.repair(completion.text()).orElse("")
                : JsonRepair.clean(completion.text());
        if (text.isBlank()) {
            log.warn("[{}] empty narrative response", purpose);
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(text);
            String summary = root.path("summary").asText("").trim();
            String recommendation = root.path("recommendation").asText("").trim();
            if (summary.isEmpty()) {
                log.warn("[{}] narrative response has no summary", purpose);
                return Optional.empty();
            }
            return Optional.of(new Narrative(summary, recommendation));
        } catch (JsonProcessingException e) {
            log.warn("[{}] unparseable narrative response: {}", purpose, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
