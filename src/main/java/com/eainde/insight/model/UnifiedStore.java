package com.eainde.insight.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Per-platform, per-date store of canonical measurements.
 *
 * <p>Built by the ingestion pipeline, then {@link #seal() sealed} and handed read-only to the
 * analysis phase. Each platform holds at most one bucket per date: merging a record into an
 * existing date sums its {@link MetricField.Kind#COUNT} fields and averages its
 * {@link MetricField.Kind#RATE} fields.
 *
 * <p>Not thread-safe while open. Once sealed it is never modified again, so concurrent readers
 * need no locking.
 */
public final class UnifiedStore {

    private final Map<Platform, TreeMap<LocalDate, Bucket>> buckets = new EnumMap<>(Platform.class);
    private final List<SkippedFile> skippedFiles = new ArrayList<>();
    private int droppedRows;
    private volatile boolean sealed;

    public static UnifiedStore empty() {
        UnifiedStore store = new UnifiedStore();
        store.seal();
        return store;
    }

    // =========================================================================
    //  Building
    // =========================================================================

    public void add(TypedRecord record) {
        checkOpen();
        merge(record);
    }

    public void addAll(List<TypedRecord> records) {
        records.forEach(this::add);
    }

    /**
     * Folds the rows of one pre-aggregated file into the platform's buckets.
     */
    public void addPreAggregated(Platform platform, List<TypedRecord> totals, AggregationPolicy policy) {
        checkOpen();
        if (totals.isEmpty()) {
            return;
        }
        TreeMap<LocalDate, Bucket> existing = buckets.get(platform);
        if (policy == AggregationPolicy.SINGLE_DAY || existing == null || existing.isEmpty()) {
            totals.forEach(this::merge);
            return;
        }

        Map<MetricField, Double> sums = new EnumMap<>(MetricField.class);
        Map<MetricField, Integer> rateSamples = new EnumMap<>(MetricField.class);
        for (TypedRecord total : totals) {
            total.values().forEach((field, value) -> {
                sums.merge(field, value, Double::sum);
                if (field.isRate()) {
                    rateSamples.merge(field, 1, Integer::sum);
                }
            });
        }

        double share = 1.0 / existing.size();
        for (Bucket bucket : existing.values()) {
            sums.forEach((field, sum) -> {
                if (field.isRate()) {
                    bucket.addRate(field, sum / rateSamples.get(field));
                } else {
                    bucket.addCount(field, sum * share);
                }
            });
        }
    }

    public void recordSkip(SkippedFile skippedFile) {
        checkOpen();
        skippedFiles.add(skippedFile);
    }

    public void recordDroppedRows(int count) {
        checkOpen();
        droppedRows += count;
    }

    public void seal() {
        sealed = true;
    }

    // =========================================================================
    //  Reading
    // =========================================================================

    /**
     * Records for one platform in ascending date order.
     */
    public List<TypedRecord> records(Platform platform) {
        TreeMap<LocalDate, Bucket> byDate = buckets.get(platform);
        if (byDate == null) {
            return List.of();
        }
        List<TypedRecord> out = new ArrayList<>(byDate.size());
        byDate.forEach((date, bucket) -> out.add(bucket.toRecord(platform, date)));
        return Collections.unmodifiableList(out);
    }

    public Set<Platform> platforms() {
        return Collections.unmodifiableSet(buckets.keySet());
    }

    public int recordCount(Platform platform) {
        TreeMap<LocalDate, Bucket> byDate = buckets.get(platform);
        return byDate == null ? 0 : byDate.size();
    }

    public int totalRecords() {
        return buckets.values().stream().mapToInt(Map::size).sum();
    }

    public boolean isEmpty() {
        return totalRecords() == 0;
    }

    public List<SkippedFile> skippedFiles() {
        return Collections.unmodifiableList(skippedFiles);
    }

    public int droppedRows() {
        return droppedRows;
    }

    public boolean isSealed() {
        return sealed;
    }

    // =========================================================================
    //  Internals
    // =========================================================================

    private void merge(TypedRecord record) {
        Bucket bucket = buckets
                .computeIfAbsent(record.platform(), p -> new TreeMap<>())
                .computeIfAbsent(record.date(), d -> new Bucket());
        record.values().forEach((field, value) -> {
            if (field.isRate()) {
                bucket.addRate(field, value);
            } else {
                bucket.addCount(field, value);
            }
        });
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("UnifiedStore is sealed and can no longer be modified");
        }
    }

    private static final class Bucket {

        private final Map<MetricField, Double> sums = new EnumMap<>(MetricField.class);
        private final Map<MetricField, Integer> rateSamples = new EnumMap<>(MetricField.class);

        void addCount(MetricField field, double value) {
            sums.merge(field, value, Double::sum);
        }

        void addRate(MetricField field, double value) {
            sums.merge(field, value, Double::sum);
            rateSamples.merge(field, 1, Integer::sum);
        }

        TypedRecord toRecord(Platform platform, LocalDate date) {
            Map<MetricField, Double> values = new EnumMap<>(MetricField.class);
            sums.forEach((field, sum) -> values.put(field,
                    field.isRate() ? sum / rateSamples.get(field) : sum));
            return new TypedRecord(platform, date, values);
        }
    }
}
