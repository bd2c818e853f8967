package com.eainde.insight.analysis;

import com.eainde.insight.model.MetricField;
import com.eainde.insight.model.TypedRecord;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Pure statistical features over date-ordered records.
 */
public final class MetricStatistics {

    /** Weeks with fewer records than this are left out of cadence analysis. */
    static final int MIN_RECORDS_PER_WEEK = 5;

    private MetricStatistics() {
    }

    /**
     * Trailing window against the window immediately before it.
     */
    public record PeriodComparison(
            double recentMean,
            double priorMean,
            int recentCount,
            int priorCount,
            LocalDate recentFrom,
            LocalDate recentTo
    ) {

        public boolean hasPrior() {
            return priorCount > 0;
        }

        /** Percentage change from prior to recent; empty without a usable prior mean. */
        public OptionalDouble changePct() {
            if (!hasPrior() || priorMean == 0.0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of((recentMean - priorMean) / Math.abs(priorMean) * 100.0);
        }
    }

    public record WeeklyBucket(LocalDate weekStart, int days, double volume, double rate) {
    }

    public record CadenceContrast(double busyRate, double quietRate, int weeksPerSide) {
    }

    public record ThresholdSplit(int daysAbove, int daysBelow, double volumeAbove, double volumeBelow) {

        public int total() {
            return daysAbove + daysBelow;
        }

        public double shareAbove() {
            return total() == 0 ? 0.0 : (double) daysAbove / total();
        }
    }

    // =========================================================================
    //  Metric extractors
    // =========================================================================

    public static Function<TypedRecord, OptionalDouble> field(MetricField field) {
        return r -> r.value(field);
    }

    public static Function<TypedRecord, OptionalDouble> ratio(MetricField numerator, MetricField denominator) {
        return r -> {
            OptionalDouble num = r.value(numerator);
            OptionalDouble den = r.value(denominator);
            if (num.isEmpty() || den.isEmpty() || den.getAsDouble() == 0.0) {
                return OptionalDouble.empty();
            }
            return OptionalDouble.of(num.getAsDouble() / den.getAsDouble());
        };
    }

    // =========================================================================
    //  Features
    // =========================================================================

    /**
     * Compares the mean of the last {@code window} observed values with the mean of up to
     * {@code window} values before them. Records without a value are ignored.
     */
    public static Optional<PeriodComparison> compare(List<TypedRecord> records,
                                                     Function<TypedRecord, OptionalDouble> metric,
                                                     int window) {
        List<TypedRecord> observed = new ArrayList<>();
        List<Double> values = new ArrayList<>();
        for (TypedRecord record : records) {
            OptionalDouble v = metric.apply(record);
            if (v.isPresent()) {
                observed.add(record);
                values.add(v.getAsDouble());
            }
        }
        if (values.isEmpty()) {
            return Optional.empty();
        }

        int n = values.size();
        int recentStart = Math.max(0, n - window);
        int priorStart = Math.max(0, recentStart - window);
        List<Double> recent = values.subList(recentStart, n);
        List<Double> prior = values.subList(priorStart, recentStart);

        return Optional.of(new PeriodComparison(
                mean(recent),
                prior.isEmpty() ? 0.0 : mean(prior),
                recent.size(),
                prior.size(),
                observed.get(recentStart).date(),
                observed.get(n - 1).date()));
    }

    /**
     * Groups records into Monday-based calendar weeks, keeping weeks with at least
     * {@value #MIN_RECORDS_PER_WEEK} records and at least one rate value.
     */
    public static List<WeeklyBucket> weeklyBuckets(List<TypedRecord> records,
                                                   MetricField volumeField,
                                                   Function<TypedRecord, OptionalDouble> rate) {
        Map<LocalDate, List<TypedRecord>> byWeek = new TreeMap<>();
        for (TypedRecord record : records) {
            byWeek.computeIfAbsent(record.date().with(DayOfWeek.MONDAY), w -> new ArrayList<>()).add(record);
        }

        List<WeeklyBucket> weeks = new ArrayList<>();
        byWeek.forEach((weekStart, days) -> {
            if (days.size() < MIN_RECORDS_PER_WEEK) {
                return;
            }
            double volume = days.stream().mapToDouble(r -> r.valueOrZero(volumeField)).sum();
            OptionalDouble weekRate = days.stream()
                    .map(rate)
                    .filter(OptionalDouble::isPresent)
                    .mapToDouble(OptionalDouble::getAsDouble)
                    .average();
            if (weekRate.isPresent()) {
                weeks.add(new WeeklyBucket(weekStart, days.size(), volume, weekRate.getAsDouble()));
            }
        });
        return weeks;
    }

    /**
     * Mean rate of the busier half of the weeks against the quieter half. With an odd number
     * of weeks the median week is left out.
     */
    public static CadenceContrast busyVersusQuiet(List<WeeklyBucket> weeks) {
        List<WeeklyBucket> sorted = new ArrayList<>(weeks);
        sorted.sort(Comparator.comparingDouble(WeeklyBucket::volume).reversed());
        int half = sorted.size() / 2;
        double busy = sorted.subList(0, half).stream().mapToDouble(WeeklyBucket::rate).average().orElse(0.0);
        double quiet = sorted.subList(sorted.size() - half, sorted.size()).stream()
                .mapToDouble(WeeklyBucket::rate).average().orElse(0.0);
        return new CadenceContrast(busy, quiet, half);
    }

    /**
     * Splits days by whether the rate reaches {@code threshold} and averages the volume field
     * on each side.
     */
    public static ThresholdSplit split(List<TypedRecord> records, MetricField rateField,
                                       MetricField volumeField, double threshold) {
        int above = 0;
        int below = 0;
        double volumeAbove = 0.0;
        double volumeBelow = 0.0;
        for (TypedRecord record : records) {
            OptionalDouble rate = record.value(rateField);
            if (rate.isEmpty()) {
                continue;
            }
            if (rate.getAsDouble() >= threshold) {
                above++;
                volumeAbove += record.valueOrZero(volumeField);
            } else {
                below++;
                volumeBelow += record.valueOrZero(volumeField);
            }
        }
        return new ThresholdSplit(above, below,
                above == 0 ? 0.0 : volumeAbove / above,
                below == 0 ? 0.0 : volumeBelow / below);
    }

    /** Mean of the metric over the records that carry it. */
    public static OptionalDouble average(List<TypedRecord> records, Function<TypedRecord, OptionalDouble> metric) {
        return records.stream()
                .map(metric)
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .average();
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
