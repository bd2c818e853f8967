package com.eainde.insight.analysis;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.Platform;
import com.eainde.insight.model.TypedRecord;
import com.eainde.insight.model.UnifiedStore;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Synthetic daily series for analysis tests. Day 0 is Monday 2024-01-01; volume grows
 * linearly.
 */
public final class SeriesFixtures {

    public static final LocalDate START = LocalDate.of(2024, 1, 1);

    private SeriesFixtures() {
    }

    public static List<TypedRecord> linkedin(int days) {
        List<TypedRecord> records = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            records.add(TypedRecord.of(Platform.LINKEDIN, START.plusDays(i), Map.of(
                    MetricField.IMPRESSIONS, 1000.0 + 10 * i,
                    MetricField.CLICKS, 20.0 + i % 4,
                    MetricField.REACTIONS, 30.0 + i % 5,
                    MetricField.ENGAGEMENT_RATE, 0.04 + (i % 3) * 0.01)));
        }
        return records;
    }

    public static List<TypedRecord> website(int days) {
        List<TypedRecord> records = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            records.add(TypedRecord.of(Platform.WEBSITE, START.plusDays(i), Map.of(
                    MetricField.PAGE_VIEWS, 500.0 - 2 * i,
                    MetricField.UNIQUE_VISITORS, 300.0 - i,
                    MetricField.BOUNCE_RATE, 0.55 + (i % 2) * 0.1)));
        }
        return records;
    }

    public static List<TypedRecord> instagram(int days) {
        List<TypedRecord> records = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            records.add(TypedRecord.of(Platform.INSTAGRAM, START.plusDays(i), Map.of(
                    MetricField.IMPRESSIONS, 800.0,
                    MetricField.LIKES, 60.0 + i % 10,
                    MetricField.ENGAGEMENT_RATE, 0.08 + (i % 5) * 0.01)));
        }
        return records;
    }

    @SafeVarargs
    public static UnifiedStore sealedStore(List<TypedRecord>... series) {
        UnifiedStore store = new UnifiedStore();
        for (List<TypedRecord> records : series) {
            store.addAll(records);
        }
        store.seal();
        return store;
    }
}
