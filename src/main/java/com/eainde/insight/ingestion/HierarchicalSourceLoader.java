package com.eainde.insight.ingestion;

import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;
import com.eainde.insight.schema.SourceKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Loads JSON exports. Entries live in the array at the mapping's records path; without one the
 * root array, or the first array directly under the root object, is used. Fields are addressed
 * by dot path with numeric list indices.
 */
@Slf4j
public class HierarchicalSourceLoader extends AbstractSourceLoader<JsonNode, JsonNode> {

    private static final Set<SourceKind> MAPPABLE = EnumSet.of(SourceKind.CONTENT, SourceKind.POSTS, SourceKind.REACH);
    private static final int MAX_SAMPLE_DEPTH = 4;
    private static final int MAX_SAMPLE_FIELDS = 60;

    private final ObjectMapper objectMapper;

    public HierarchicalSourceLoader(FilenameHeuristics heuristics, ObjectMapper objectMapper) {
        super(heuristics);
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceFamily family() {
        return SourceFamily.HIERARCHICAL;
    }

    @Override
    public JsonNode parse(SourceFile file) throws FileLoadException {
        try (Reader reader = file.openReader()) {
            JsonNode root = objectMapper.readTree(reader);
            if (root == null || root.isMissingNode()) {
                throw new FileLoadException("Empty JSON document " + file.name());
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FileLoadException("Malformed JSON in " + file.name() + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new FileLoadException("Cannot read " + file.name() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Sample sample(SourceFile file, JsonNode root, int rows) {
        List<JsonNode> entries = entries(root, null);
        List<String> fields = new ArrayList<>();
        if (!entries.isEmpty()) {
            flatten(entries.get(0), "", 0, fields);
        }
        List<Object> sampleRows = new ArrayList<>(entries.subList(0, Math.min(rows, entries.size())));
        return new Sample(file.name(), family(), fields, sampleRows);
    }

    @Override
    protected Set<SourceKind> mappableKinds() {
        return MAPPABLE;
    }

    @Override
    protected List<JsonNode> entries(JsonNode root, SchemaMapping mapping) {
        if (mapping != null && mapping.getRecordsPath() != null) {
            return FieldPath.resolve(root, mapping.getRecordsPath())
                    .map(HierarchicalSourceLoader::elements)
                    .orElse(List.of());
        }
        if (root.isArray()) {
            return elements(root);
        }
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray()) {
                    return elements(value);
                }
            }
            return List.of(root);
        }
        return List.of();
    }

    @Override
    protected Optional<String> resolve(JsonNode entry, String path) {
        return FieldPath.resolve(entry, path).map(node -> {
            if (node.isNull()) {
                return "";
            }
            return node.isValueNode() ? node.asText() : node.toString();
        });
    }

    private static List<JsonNode> elements(JsonNode node) {
        if (!node.isArray()) {
            return node.isObject() ? List.of(node) : List.of();
        }
        List<JsonNode> out = new ArrayList<>(node.size());
        node.forEach(out::add);
        return out;
    }

    private static void flatten(JsonNode node, String prefix, int depth, List<String> out) {
        if (out.size() >= MAX_SAMPLE_FIELDS) {
            return;
        }
        if (node.isObject() && depth < MAX_SAMPLE_DEPTH) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flatten(field.getValue(), prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey(), depth + 1, out);
            }
        } else if (node.isArray() && node.size() > 0 && depth < MAX_SAMPLE_DEPTH) {
            flatten(node.get(0), prefix + ".0", depth + 1, out);
        } else if (!prefix.isEmpty()) {
            out.add(prefix);
        }
    }
}
