package com.daylock.engine.weekly;

import com.daylock.engine.discipline.QualityRatings;
import com.daylock.engine.model.AttendanceRecord;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.time.temporal.WeekFields;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Buckets an attendance history into calendar weeks and compares the two most recent.
 *
 * <p>A record belongs to the week starting on the nearest {@code firstDayOfWeek} on or
 * before its date. One call uses one first day for every record, so buckets never
 * overlap: feeding a bucket's {@code [weekStart, weekEnd]} range back as a filter
 * reproduces its counts exactly.
 *
 * <p>Single pass over the input for bucketing; the trend looks at two buckets only.
 */
public final class WeeklyAggregator {

    /** Change (percentage points) beyond which a trend stops being stable. */
    public static final int TREND_THRESHOLD = 5;

    private WeeklyAggregator() {}

    /** Weeks starting on Sunday. */
    public static List<WeekBucket> aggregate(List<AttendanceRecord> records) {
        return aggregate(records, DayOfWeek.SUNDAY);
    }

    public static List<WeekBucket> aggregate(List<AttendanceRecord> records, Locale locale) {
        return aggregate(records, WeekFields.of(locale).getFirstDayOfWeek());
    }

    /**
     * @return one bucket per week present in the input, newest week first; empty for no records
     */
    public static List<WeekBucket> aggregate(List<AttendanceRecord> records, DayOfWeek firstDayOfWeek) {
        if (records == null || records.isEmpty()) return List.of();

        Map<LocalDate, Tally> weeks = new HashMap<>();
        for (AttendanceRecord record : records) {
            if (record == null || record.date() == null) continue;
            weeks.computeIfAbsent(weekStart(record.date(), firstDayOfWeek), Tally::new).add(record);
        }

        return weeks.values().stream()
            .map(Tally::toBucket)
            .sorted(Comparator.comparing(WeekBucket::weekStart).reversed())
            .toList();
    }

    /**
     * Compares {@code buckets[0]} (latest) with {@code buckets[1]}.
     * Fewer than two buckets read as stable with no change.
     */
    public static WeeklyTrend computeTrend(List<WeekBucket> buckets) {
        if (buckets == null || buckets.size() < 2) return WeeklyTrend.STABLE;

        int change = buckets.get(0).rate() - buckets.get(1).rate();
        if (change > TREND_THRESHOLD)  return new WeeklyTrend(TrendDirection.IMPROVING, change);
        if (change < -TREND_THRESHOLD) return new WeeklyTrend(TrendDirection.DECLINING, change);
        return new WeeklyTrend(TrendDirection.STABLE, change);
    }

    public static LocalDate weekStart(LocalDate date, DayOfWeek firstDayOfWeek) {
        return date.with(TemporalAdjusters.previousOrSame(firstDayOfWeek));
    }

    private static final class Tally {
        private final LocalDate weekStart;
        private int total;
        private int approved;
        private int rejected;
        private int missed;
        private int qualitySum;
        private int qualityCount;

        Tally(LocalDate weekStart) {
            this.weekStart = weekStart;
        }

        void add(AttendanceRecord record) {
            total++;
            if (record.status() != null) {
                switch (record.status()) {
                    case APPROVED -> approved++;
                    case REJECTED -> rejected++;
                    case MISSED   -> missed++;
                    case PENDING_REVIEW -> { }
                }
            }
            if (record.hasQualityRating()) {
                qualitySum += record.qualityRating();
                qualityCount++;
            }
        }

        WeekBucket toBucket() {
            int rate = total > 0 ? (int) Math.round(approved * 100.0 / total) : 0;
            Double avgQuality = qualityCount > 0
                ? QualityRatings.roundOneDecimal((double) qualitySum / qualityCount)
                : null;
            return new WeekBucket(weekStart, total, approved, rejected, missed, rate, avgQuality);
        }
    }
}
