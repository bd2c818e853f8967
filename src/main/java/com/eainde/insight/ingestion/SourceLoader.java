package com.eainde.insight.ingestion;

import com.eainde.insight.model.SkipReason;
import com.eainde.insight.schema.Sample;
import com.eainde.insight.schema.SchemaMapping;
import com.eainde.insight.schema.SourceFamily;

/**
 * Reads one family of source files and turns them into typed records.
 *
 * @param <D> parsed document type of the family
 */
public interface SourceLoader<D> {

    SourceFamily family();

    /**
     * Reads and parses the whole file.
     *
     * @throws FileLoadException when the file cannot be read or is not well-formed
     */
    D parse(SourceFile file) throws FileLoadException;

    /**
     * Field names and first {@code rows} rows or entries, for schema discovery.
     */
    Sample sample(SourceFile file, D document, int rows);

    /**
     * Extracts records using {@code mapping}, falling back to filename heuristics when the
     * mapping is null or does not fit the document. Never throws for bad rows.
     */
    LoadResult load(SourceFile file, D document, SchemaMapping mapping);

    /**
     * Parse and load in one step; an unreadable file becomes a skip.
     */
    default LoadResult load(SourceFile file, SchemaMapping mapping) {
        try {
            return load(file, parse(file), mapping);
        } catch (FileLoadException e) {
            return LoadResult.skipped(file.name(), SkipReason.UNREADABLE, e.getMessage());
        }
    }
}
