package com.eainde.insight.ingestion;

import com.eainde.insight.model.SkipReason;
import com.eainde.insight.model.SkippedFile;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.schema.AggregationLevel;
import com.eainde.insight.schema.MappingOrigin;

import java.util.List;

/**
 * Outcome of loading one file: either its records or the reason it was skipped.
 */
public final class LoadResult {

    private final String fileName;
    private final List<TypedRecord> records;
    private final AggregationLevel aggregationLevel;
    private final MappingOrigin origin;
    private final int droppedRows;
    private final SkipReason skipReason;
    private final String detail;

    private LoadResult(String fileName, List<TypedRecord> records, AggregationLevel aggregationLevel,
                       MappingOrigin origin, int droppedRows, SkipReason skipReason, String detail) {
        this.fileName = fileName;
        this.records = List.copyOf(records);
        this.aggregationLevel = aggregationLevel;
        this.origin = origin;
        this.droppedRows = droppedRows;
        this.skipReason = skipReason;
        this.detail = detail;
    }

    public static LoadResult loaded(String fileName, List<TypedRecord> records, AggregationLevel level,
                                    MappingOrigin origin, int droppedRows) {
        return new LoadResult(fileName, records, level, origin, droppedRows, null, null);
    }

    public static LoadResult skipped(String fileName, SkipReason reason, String detail) {
        return skipped(fileName, reason, detail, 0);
    }

    public static LoadResult skipped(String fileName, SkipReason reason, String detail, int droppedRows) {
        return new LoadResult(fileName, List.of(), AggregationLevel.PER_ROW, null, droppedRows, reason, detail);
    }

    public String getFileName() {
        return fileName;
    }

    public List<TypedRecord> getRecords() {
        return records;
    }

    public AggregationLevel getAggregationLevel() {
        return aggregationLevel;
    }

    /** Where the applied mapping came from; null for skipped files. */
    public MappingOrigin getOrigin() {
        return origin;
    }

    public int getDroppedRows() {
        return droppedRows;
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    public SkipReason getSkipReason() {
        return skipReason;
    }

    public String getDetail() {
        return detail;
    }

    public SkippedFile toSkippedFile() {
        if (!isSkipped()) {
            throw new IllegalStateException(fileName + " was not skipped");
        }
        return new SkippedFile(fileName, skipReason, detail);
    }

    @Override
    public String toString() {
        return isSkipped()
                ? "LoadResult{" + fileName + " skipped: " + skipReason + " (" + detail + ")}"
                : "LoadResult{" + fileName + " records=" + records.size() + ", dropped=" + droppedRows
                        + ", level=" + aggregationLevel + ", origin=" + origin + "}";
    }
}
