package com.eainde.insight.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One dated measurement for one platform, carrying canonical fields only.
 */
public record TypedRecord(Platform platform, LocalDate date, Map<MetricField, Double> values) {

    public TypedRecord {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(date, "date");
        EnumMap<MetricField, Double> copy = new EnumMap<>(MetricField.class);
        if (values != null) {
            copy.putAll(values);
        }
        values = Collections.unmodifiableMap(copy);
    }

    public static TypedRecord of(Platform platform, LocalDate date, Map<MetricField, Double> values) {
        return new TypedRecord(platform, date, values);
    }

    public OptionalDouble value(MetricField field) {
        Double v = values.get(field);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public double valueOrZero(MetricField field) {
        return values.getOrDefault(field, 0.0);
    }

    public boolean has(MetricField field) {
        return values.containsKey(field);
    }
}
