package com.eainde.insight.ingestion;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.TypedRecord;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fills in metrics a source does not report but whose inputs it does.
 * Currently: engagement rate as interactions per impression.
 */
final class DerivedMetrics {

    private static final List<MetricField> INTERACTIONS =
            List.of(MetricField.LIKES, MetricField.COMMENTS, MetricField.SHARES);

    private DerivedMetrics() {
    }

    static List<TypedRecord> apply(List<TypedRecord> records) {
        return records.stream().map(DerivedMetrics::apply).toList();
    }

    static TypedRecord apply(TypedRecord record) {
        if (record.has(MetricField.ENGAGEMENT_RATE) || record.valueOrZero(MetricField.IMPRESSIONS) <= 0.0
                || INTERACTIONS.stream().noneMatch(record::has)) {
            return record;
        }
        double interactions = INTERACTIONS.stream().mapToDouble(record::valueOrZero).sum();
        Map<MetricField, Double> values = new EnumMap<>(MetricField.class);
        values.putAll(record.values());
        values.put(MetricField.ENGAGEMENT_RATE, interactions / record.valueOrZero(MetricField.IMPRESSIONS));
        return new TypedRecord(record.platform(), record.date(), values);
    }
}
