package com.eainde.insight.schema;

import com.eainde.insight.model.MetricField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * How the fields of one source file map onto canonical metrics.
 *
 * <p>Immutable. Produced either by the schema oracle or by filename heuristics; once produced
 * for a fingerprint it is owned by the {@link SchemaCache}.
 */
public final class SchemaMapping {

    private final SourceKind sourceKind;
    private final String timeKeyPath;
    private final String dateFormat;
    private final String recordsPath;
    private final Map<MetricField, String> fieldPaths;
    private final AggregationLevel aggregationLevel;
    private final MappingOrigin origin;

    private SchemaMapping(Builder builder) {
        this.sourceKind = Objects.requireNonNull(builder.sourceKind, "sourceKind");
        this.timeKeyPath = builder.timeKeyPath;
        this.dateFormat = builder.dateFormat;
        this.recordsPath = builder.recordsPath;
        this.fieldPaths = Collections.unmodifiableMap(new EnumMap<>(builder.fieldPaths));
        this.aggregationLevel = builder.aggregationLevel;
        this.origin = builder.origin;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    /** Column name or dot path of the date field; may be null when the source carries none. */
    public String getTimeKeyPath() {
        return timeKeyPath;
    }

    /** Optional date format hint, Java or strftime style. */
    public String getDateFormat() {
        return dateFormat;
    }

    /** Dot path to the entry array of a hierarchical file; null means auto-detect. */
    public String getRecordsPath() {
        return recordsPath;
    }

    public Map<MetricField, String> getFieldPaths() {
        return fieldPaths;
    }

    public AggregationLevel getAggregationLevel() {
        return aggregationLevel;
    }

    public MappingOrigin getOrigin() {
        return origin;
    }

    public boolean hasFieldPaths() {
        return !fieldPaths.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaMapping that)) return false;
        return sourceKind == that.sourceKind
                && Objects.equals(timeKeyPath, that.timeKeyPath)
                && Objects.equals(dateFormat, that.dateFormat)
                && Objects.equals(recordsPath, that.recordsPath)
                && fieldPaths.equals(that.fieldPaths)
                && aggregationLevel == that.aggregationLevel
                && origin == that.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceKind, timeKeyPath, dateFormat, recordsPath, fieldPaths, aggregationLevel, origin);
    }

    @Override
    public String toString() {
        return "SchemaMapping{kind=" + sourceKind + ", timeKey=" + timeKeyPath
                + ", fields=" + fieldPaths.keySet() + ", level=" + aggregationLevel
                + ", origin=" + origin + "}";
    }

    public static class Builder {
        private SourceKind sourceKind = SourceKind.UNCLASSIFIED;
        private String timeKeyPath;
        private String dateFormat;
        private String recordsPath;
        private final Map<MetricField, String> fieldPaths = new EnumMap<>(MetricField.class);
        private AggregationLevel aggregationLevel = AggregationLevel.PER_ROW;
        private MappingOrigin origin = MappingOrigin.ORACLE;

        public Builder sourceKind(SourceKind v) { this.sourceKind = v; return this; }
        public Builder timeKeyPath(String v) { this.timeKeyPath = v; return this; }
        public Builder dateFormat(String v) { this.dateFormat = v; return this; }
        public Builder recordsPath(String v) { this.recordsPath = v; return this; }
        public Builder field(MetricField field, String path) { this.fieldPaths.put(field, path); return this; }
        public Builder fields(Map<MetricField, String> v) { this.fieldPaths.putAll(v); return this; }
        public Builder aggregationLevel(AggregationLevel v) { this.aggregationLevel = v; return this; }
        public Builder origin(MappingOrigin v) { this.origin = v; return this; }

        public SchemaMapping build() {
            return new SchemaMapping(this);
        }
    }
}
