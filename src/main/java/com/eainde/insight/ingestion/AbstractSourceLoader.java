package com.eainde.insight.ingestion;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.SkipReason;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Mapping selection and row extraction shared by both loader families.
 *
 * <h3>Mapping selection:</h3>
 * <pre>
 * oracle mapping present, kind mappable, fits first entry?  → use it (unfit fields pruned)
 * otherwise filename heuristic for this family?
 *     no rule            → skip UNCLASSIFIED
 *     rule without paths → skip UNMAPPABLE
 *     rule               → use it (unfit fields pruned)
 * </pre>
 *
 * <h3>Row extraction:</h3>
 * Missing time key, unparseable date, unresolvable mapped path or non-numeric value drops the
 * row. Blank values leave the field absent.
 *
 * @param <D> parsed document type
 * @param <E> entry (row) type
 */
public abstract class AbstractSourceLoader<D, E> implements SourceLoader<D> {

    private static final Logger log = LoggerFactory.getLogger(AbstractSourceLoader.class);

    protected final FilenameHeuristics heuristics;

    protected AbstractSourceLoader(FilenameHeuristics heuristics) {
        this.heuristics = heuristics;
    }

    /** Kinds this family can turn into time series. */
    protected abstract Set<SourceKind> mappableKinds();

    /** Entries of the document, located with the mapping's records path when it has one; mapping may be null. */
    protected abstract List<E> entries(D document, SchemaMapping mapping);

    /**
     * Raw text at {@code path}; empty when the path does not exist, blank when it exists
     * without a value.
     */
    protected abstract Optional<String> resolve(E entry, String path);

    @Override
    public LoadResult load(SourceFile file, D document, SchemaMapping oracleMapping) {
        List<E> entries = entries(document, oracleMapping);
        SchemaMapping mapping = oracleMapping != null ? fit(oracleMapping, entries, file.name()) : null;
        if (mapping == null) {
            Optional<FilenameHeuristics.Rule> rule = heuristics.match(file.name(), family());
            if (rule.isEmpty()) {
                return LoadResult.skipped(file.name(), SkipReason.UNCLASSIFIED, "no oracle mapping and no filename rule");
            }
            if (!rule.get().isMappable()) {
                return LoadResult.skipped(file.name(), SkipReason.UNMAPPABLE,
                        "kind " + rule.get().kind().label() + " carries no time series");
            }
            SchemaMapping heuristic = rule.get().toMapping();
            entries = entries(document, heuristic);
            if (entries.isEmpty()) {
                return LoadResult.skipped(file.name(), SkipReason.EMPTY, "no rows or entries");
            }
            mapping = fit(heuristic, entries, file.name());
            if (mapping == null) {
                return LoadResult.skipped(file.name(), SkipReason.NO_RECORDS,
                        "filename rule '" + rule.get().pattern() + "' does not match the file's fields");
            }
            log.info("Using filename heuristic '{}' for {}", rule.get().pattern(), file.name());
        }

        return extract(file, entries, mapping);
    }

    // =========================================================================
    //  Mapping fit
    // =========================================================================

    /**
     * Returns the mapping restricted to paths that resolve on the first entry, or null when the
     * kind is not mappable here, the time key does not resolve, or no field path survives.
     */
    private SchemaMapping fit(SchemaMapping mapping, List<E> entries, String fileName) {
        if (entries.isEmpty()
                || !mappableKinds().contains(mapping.getSourceKind())
                || mapping.getTimeKeyPath() == null
                || !mapping.hasFieldPaths()) {
            return null;
        }
        E first = entries.get(0);
        if (resolve(first, mapping.getTimeKeyPath()).isEmpty()) {
            log.warn("{} mapping for {} names time key '{}' which is not in the file",
                    mapping.getOrigin(), fileName, mapping.getTimeKeyPath());
            return null;
        }

        Map<MetricField, String> kept = new EnumMap<>(MetricField.class);
        mapping.getFieldPaths().forEach((field, path) -> {
            if (resolve(first, path).isPresent()) {
                kept.put(field, path);
            } else {
                log.debug("Dropping {} → '{}' for {}: path not present", field.key(), path, fileName);
            }
        });
        if (kept.isEmpty()) {
            return null;
        }
        if (kept.size() == mapping.getFieldPaths().size()) {
            return mapping;
        }
        return SchemaMapping.builder()
                .sourceKind(mapping.getSourceKind())
                .timeKeyPath(mapping.getTimeKeyPath())
                .dateFormat(mapping.getDateFormat())
                .recordsPath(mapping.getRecordsPath())
                .aggregationLevel(mapping.getAggregationLevel())
                .origin(mapping.getOrigin())
                .fields(kept)
                .build();
    }

    // =========================================================================
    //  Extraction
    // =========================================================================

    private LoadResult extract(SourceFile file, List<E> entries, SchemaMapping mapping) {
        List<TypedRecord> records = new ArrayList<>(entries.size());
        int dropped = 0;
        for (int i = 0; i < entries.size(); i++) {
            try {
                records.add(toRecord(file, entries.get(i), mapping));
            } catch (RowExtractionException e) {
                dropped++;
                log.debug("{} row {} dropped: {}", file.name(), i + 1, e.getMessage());
            }
        }

        if (dropped > 0) {
            log.warn("{}: dropped {} of {} rows", file.name(), dropped, entries.size());
        }
        if (records.isEmpty()) {
            return LoadResult.skipped(file.name(), SkipReason.NO_RECORDS,
                    "all " + entries.size() + " rows dropped", dropped);
        }
        return LoadResult.loaded(file.name(), records, mapping.getAggregationLevel(), mapping.getOrigin(), dropped);
    }

    private TypedRecord toRecord(SourceFile file, E entry, SchemaMapping mapping) throws RowExtractionException {
        String rawDate = resolve(entry, mapping.getTimeKeyPath())
                .orElseThrow(() -> new RowExtractionException("missing time key " + mapping.getTimeKeyPath()));
        LocalDate date = DateParser.parse(rawDate, mapping.getDateFormat())
                .orElseThrow(() -> new RowExtractionException("unparseable date '" + rawDate + "'"));

        Map<MetricField, Double> values = new EnumMap<>(MetricField.class);
        for (Map.Entry<MetricField, String> field : mapping.getFieldPaths().entrySet()) {
            String raw = resolve(entry, field.getValue())
                    .orElseThrow(() -> new RowExtractionException("missing path " + field.getValue()));
            OptionalDouble value = MetricValues.parse(raw);
            if (value.isPresent()) {
                values.put(field.getKey(), value.getAsDouble());
            }
        }
        return new TypedRecord(file.platform(), date, values);
    }
}
