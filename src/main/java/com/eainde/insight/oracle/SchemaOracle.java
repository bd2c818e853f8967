package com.eainde.insight.oracle;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.MappingOrigin;
import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Asks the language model to classify a file sample and map its fields onto canonical metrics.
 *
 * <h3>Flow:</h3>
 * <pre>
 * Sample (names + first rows)
 *   → bounded JSON prompt
 *   → CompletionClient (hard timeout, JSON response format)
 *   → clean fences → parse
 *        ↳ truncated / cut off at end-of-input → JsonRepair → re-parse
 *   → SchemaMapping (origin = ORACLE)
 * </pre>
 *
 * <p>Stateless. Caching is the caller's job.
 */
@Slf4j
public class SchemaOracle {

    public static final String PURPOSE = "schema_discovery";

    private static final String SYSTEM_PROMPT = """
            You are a data engineer. You classify marketing analytics export files and map their
            fields onto a fixed set of canonical metrics. Respond with a single JSON object only.""";

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;
    private final int maxTokens;

    public SchemaOracle(CompletionClient completionClient, ObjectMapper objectMapper,
                        Duration timeout, int maxTokens) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        this.maxTokens = maxTokens;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Discovers the mapping for one file sample.
     *
     * @param sample          file name, field names and at most {@link Sample#MAX_ROWS} rows
     * @param candidateFields canonical fields the model may map to
     * @throws OracleUnavailableException     capability missing, timed out or failed
     * @throws OracleInvalidResponseException answer unparseable even after repair,
     *                                        or without a {@code mappings} object
     */
    public SchemaMapping discover(Sample sample, Collection<MetricField> candidateFields)
            throws OracleUnavailableException, OracleInvalidResponseException {

        String prompt = buildPrompt(sample, candidateFields);
        Completion completion = completionClient.complete(
                CompletionRequest.json(PURPOSE, SYSTEM_PROMPT, prompt, maxTokens, timeout));

        JsonNode root = parse(completion, sample.fileName());
        SchemaMapping mapping = toMapping(root, sample.fileName());
        log.info("Oracle mapped {} → kind={}, fields={}",
                sample.fileName(), mapping.getSourceKind(), mapping.getFieldPaths().keySet());
        return mapping;
    }

    // =========================================================================
    //  Prompt
    // =========================================================================

    String buildPrompt(Sample sample, Collection<MetricField> candidateFields) {
        String kinds = Arrays.stream(SourceKind.values())
                .filter(k -> k != SourceKind.UNCLASSIFIED)
                .map(SourceKind::label)
                .collect(Collectors.joining(", "));
        String canonical = candidateFields.stream()
                .map(f -> f.key() + " (" + f.label() + ", " + f.kind().name().toLowerCase() + ")")
                .collect(Collectors.joining(", "));

        return """
                File name: %s
                Source family: %s
                Fields: %s
                Sample rows (first %d):
                %s

                Allowed sourceKind values: %s
                Canonical fields: %s

                Return JSON with exactly these keys:
                {
                  "sourceKind": one of the allowed values,
                  "timeKeyPath": field holding the date (dot path for nested data, null if none),
                  "dateFormat": date pattern such as MM/dd/yyyy, or null,
                  "recordsPath": dot path of the entry array for nested data, or null,
                  "aggregationLevel": "per_row" or "pre_aggregated",
                  "mappings": { canonical field: source field or dot path }
                }
                Only map fields you are confident about. Use dot paths with numeric list indices
                for nested data, e.g. string_map_data.Impressions.value.
                """.formatted(
                sample.fileName(),
                sample.family().name().toLowerCase(),
                String.join(", ", sample.fields()),
                sample.rows().size(),
                renderRows(sample),
                kinds,
                canonical);
    }

    private String renderRows(Sample sample) {
        try {
            return objectMapper.writeValueAsString(sample.rows());
        } catch (JsonProcessingException e) {
            log.warn("Could not render sample rows of {}: {}", sample.fileName(), e.getMessage());
            return "[]";
        }
    }

    // =========================================================================
    //  Response parsing
    // =========================================================================

    private JsonNode parse(Completion completion, String fileName) throws OracleInvalidResponseException {
        String text = JsonRepair.clean(completion.text());
        if (text.isBlank()) {
            throw new OracleInvalidResponseException("Empty oracle response for " + fileName);
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            if (!completion.isTruncated() && !(e instanceof JsonEOFException)) {
                throw new OracleInvalidResponseException(
                        "Unparseable oracle response for " + fileName + ": " + e.getOriginalMessage(), e);
            }
            log.warn("Oracle response for {} was cut off (finish={}), attempting repair",
                    fileName, completion.finishReason());
            return parseRepaired(text, fileName, e);
        }
    }

    private JsonNode parseRepaired(String text, String fileName, JsonProcessingException original)
            throws OracleInvalidResponseException {
        String repaired = JsonRepair.repair(text)
                .orElseThrow(() -> new OracleInvalidResponseException(
                        "Truncated oracle response for " + fileName + " could not be repaired", original));
        try {
            return objectMapper.readTree(repaired);
        } catch (JsonProcessingException e) {
            throw new OracleInvalidResponseException(
                    "Repaired oracle response for " + fileName + " is still invalid: " + e.getOriginalMessage(), e);
        }
    }

    private SchemaMapping toMapping(JsonNode root, String fileName) throws OracleInvalidResponseException {
        if (!(root instanceof ObjectNode)) {
            throw new OracleInvalidResponseException("Oracle response for " + fileName + " is not a JSON object");
        }
        JsonNode mappings = root.get("mappings");
        if (mappings == null || !mappings.isObject()) {
            throw new OracleInvalidResponseException("Oracle response for " + fileName + " has no mappings object");
        }

        SchemaMapping.Builder builder = SchemaMapping.builder()
                .sourceKind(SourceKind.fromLabel(text(root, "sourceKind")))
                .timeKeyPath(text(root, "timeKeyPath", "timeKey"))
                .dateFormat(text(root, "dateFormat"))
                .recordsPath(text(root, "recordsPath"))
                .aggregationLevel(AggregationLevel.fromLabel(text(root, "aggregationLevel", "aggregation")))
                .origin(MappingOrigin.ORACLE);

        Iterator<Map.Entry<String, JsonNode>> entries = mappings.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Optional<MetricField> field = MetricField.fromKey(entry.getKey());
            String path = entry.getValue().isTextual() ? entry.getValue().asText().trim() : null;
            if (field.isEmpty() || path == null || path.isEmpty()) {
                log.debug("Ignoring oracle mapping {} → {} for {}", entry.getKey(), entry.getValue(), fileName);
                continue;
            }
            builder.field(field.get(), path);
        }
        return builder.build();
    }

    /** First non-blank value among {@code keys}; later keys are accepted aliases. */
    private static String text(JsonNode root, String... keys) {
        for (String key : keys) {
            String value = text(root, key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }
}
