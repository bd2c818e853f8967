package com.eainde.insight.ingestion;

import com.eainde.insight.schema.SourceFamily;

import java.util.List;

/**
 * Per-file outcomes of one source family, in input order.
 */
public record FamilyIngestion(SourceFamily family, List<LoadResult> results) {

    public FamilyIngestion {
        results = List.copyOf(results);
    }

    public long loadedCount() {
        return results.stream().filter(r -> !r.isSkipped()).count();
    }

    public long skippedCount() {
        return results.stream().filter(LoadResult::isSkipped).count();
    }

    public int recordCount() {
        return results.stream().mapToInt(r -> r.getRecords().size()).sum();
    }
}
