package com.eainde.insight.ingestion;

import com.eainde.insight.model.AggregationPolicy;
import com.eainde.insight.model.SkipReason;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.model.UnifiedStore;
import com.eainde.insight.oracle.OracleInvalidResponseException;
import com.eainde.insight.oracle.OracleUnavailableException;
import com.eainde.insight.oracle.SchemaOracle;
import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.FileFingerprint;
import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaCache;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns every discovered source file into typed records and merges them into one
 * {@link UnifiedStore}.
 *
 * <h3>Per file:</h3>
 * <pre>
 * parse → sample → fingerprint → SchemaCache hit?
 *                                   no → SchemaOracle.discover → cache.put
 *                                        (oracle failure → logged, heuristics take over)
 *       → SourceLoader.load → records | skip
 * </pre>
 *
 * <h3>Merge order:</h3>
 * All per-row records of all families first, then pre-aggregated files through the
 * configured {@link AggregationPolicy}. The store is sealed before it is returned.
 *
 * <p>A bad file never aborts the run. The only fatal condition is having no files at all.
 */
@Log4j2
public class IngestionPipeline {

    private final Map<SourceFamily, SourceLoader<?>> loaders = new EnumMap<>(SourceFamily.class);
    private final SchemaOracle schemaOracle;
    private final SchemaCache schemaCache;
    private final AggregationPolicy aggregationPolicy;
    private final int sampleRows;

    public IngestionPipeline(List<? extends SourceLoader<?>> loaders,
                             SchemaOracle schemaOracle,
                             SchemaCache schemaCache,
                             AggregationPolicy aggregationPolicy,
                             int sampleRows) {
        loaders.forEach(loader -> this.loaders.put(loader.family(), loader));
        this.schemaOracle = schemaOracle;
        this.schemaCache = schemaCache;
        this.aggregationPolicy = aggregationPolicy;
        this.sampleRows = Math.max(1, Math.min(sampleRows, Sample.MAX_ROWS));
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * Ingests all families and returns the sealed store.
     *
     * @param fileSets discovered files per family; missing families count as empty
     * @throws PipelineFatalException when no family has any file
     */
    public UnifiedStore run(Map<SourceFamily, List<SourceFile>> fileSets) throws PipelineFatalException {
        int totalFiles = fileSets.values().stream().mapToInt(List::size).sum();
        if (totalFiles == 0) {
            throw new PipelineFatalException("No source files discovered in any family");
        }
        log.info("Ingestion started: {} file(s), families {}", totalFiles, fileSets.keySet());

        // ── STEP 1: Load every family independently ─────────────────────
        List<FamilyIngestion> families = new ArrayList<>();
        for (SourceFamily family : SourceFamily.values()) {
            List<SourceFile> files = fileSets.getOrDefault(family, List.of());
            if (!files.isEmpty()) {
                families.add(ingestFamily(family, files));
            }
        }

        // ── STEP 2: Merge per-row records ───────────────────────────────
        UnifiedStore store = new UnifiedStore();
        List<LoadResult> aggregates = new ArrayList<>();
        for (FamilyIngestion family : families) {
            for (LoadResult result : family.results()) {
                store.recordDroppedRows(result.getDroppedRows());
                if (result.isSkipped()) {
                    store.recordSkip(result.toSkippedFile());
                } else if (result.getAggregationLevel() == AggregationLevel.PRE_AGGREGATED) {
                    aggregates.add(result);
                } else {
                    store.addAll(DerivedMetrics.apply(result.getRecords()));
                }
            }
        }

        // ── STEP 3: Fold in pre-aggregated files ────────────────────────
        for (LoadResult aggregate : aggregates) {
            List<TypedRecord> totals = DerivedMetrics.apply(aggregate.getRecords());
            store.addPreAggregated(totals.get(0).platform(), totals, aggregationPolicy);
            log.debug("Merged pre-aggregated {} with policy {}", aggregate.getFileName(), aggregationPolicy);
        }

        store.seal();
        log.info("Ingestion complete: {} record(s) for {}, {} file(s) skipped, {} row(s) dropped",
                store.totalRecords(), store.platforms(), store.skippedFiles().size(), store.droppedRows());
        return store;
    }

    /**
     * Loads the files of one family. Touches no shared state besides the thread-safe
     * schema cache, so families may be ingested independently.
     */
    public FamilyIngestion ingestFamily(SourceFamily family, List<SourceFile> files) {
        SourceLoader<?> loader = loaders.get(family);
        List<LoadResult> results = new ArrayList<>(files.size());

        for (SourceFile file : files) {
            if (loader == null) {
                results.add(LoadResult.skipped(file.name(), SkipReason.UNREADABLE, "no loader for " + family));
                continue;
            }
            try {
                LoadResult result = ingestFile(loader, file);
                log.info("{}", result);
                results.add(result);
            } catch (RuntimeException e) {
                log.error("Failed to process file: {}", file.name(), e);
                results.add(LoadResult.skipped(file.name(), SkipReason.UNREADABLE,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        FamilyIngestion outcome = new FamilyIngestion(family, results);
        log.info("Family {}: {} loaded, {} skipped, {} record(s)",
                family, outcome.loadedCount(), outcome.skippedCount(), outcome.recordCount());
        return outcome;
    }

    // =========================================================================
    //  Per file
    // =========================================================================

    private <D> LoadResult ingestFile(SourceLoader<D> loader, SourceFile file) {
        D document;
        try {
            document = loader.parse(file);
        } catch (FileLoadException e) {
            log.warn("Skipping unreadable file {}: {}", file.name(), e.getMessage());
            return LoadResult.skipped(file.name(), SkipReason.UNREADABLE, e.getMessage());
        }

        Sample sample = loader.sample(file, document, sampleRows);
        if (sample.rows().isEmpty()) {
            return LoadResult.skipped(file.name(), SkipReason.EMPTY, "no rows or entries");
        }

        SchemaMapping mapping = discoverMapping(file, sample).orElse(null);
        return loader.load(file, document, mapping);
    }

    private Optional<SchemaMapping> discoverMapping(SourceFile file, Sample sample) {
        FileFingerprint fingerprint = null;
        try {
            fingerprint = file.fingerprint();
        } catch (IOException e) {
            log.warn("Cannot fingerprint {}, schema will not be cached: {}", file.name(), e.getMessage());
        }

        if (fingerprint != null) {
            Optional<SchemaMapping> cached = schemaCache.get(fingerprint);
            if (cached.isPresent()) {
                return cached;
            }
        }

        try {
            SchemaMapping mapping = schemaOracle.discover(sample, file.platform().metricFields());
            if (fingerprint != null) {
                schemaCache.put(fingerprint, mapping);
            }
            return Optional.of(mapping);
        } catch (OracleUnavailableException e) {
            log.warn("Schema oracle unavailable for {}, falling back to filename heuristics: {}",
                    file.name(), e.getMessage());
        } catch (OracleInvalidResponseException e) {
            log.warn("Schema oracle answer for {} unusable, falling back to filename heuristics: {}",
                    file.name(), e.getMessage());
        }
        return Optional.empty();
    }
}
