package com.daylock.engine.warning;

import com.daylock.engine.discipline.QualityRatings;
import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.AttendanceStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Scans an attendance history against fixed threshold rules and reports the patterns
 * an operator should look at.
 *
 * <h3>Rules (each fires at most once per evaluation)</h3>
 * <ol>
 *   <li><strong>Consecutive misses</strong>: leading run of missed records ≥ 3.</li>
 *   <li><strong>Low attendance rate</strong>: trailing 14 days hold ≥ 5 records and the
 *       rounded approval rate is below 50%.</li>
 *   <li><strong>Repeated rejections</strong>: ≥ 3 rejected among the 7 newest records.</li>
 *   <li><strong>Low quality average</strong>: one-decimal mean rating over the trailing
 *       14 days is below 2.</li>
 *   <li><strong>Prolonged inactivity</strong>: ≥ 7 days since the newest non-missed record.</li>
 * </ol>
 *
 * <p>Rules are independent and order-independent; the output lists fired warnings in the
 * order above. Records are sorted newest-first internally. Pure function.
 */
public final class WarningDetector {

    private WarningDetector() {}

    public static List<Warning> detect(List<AttendanceRecord> records, Clock clock) {
        return detect(records, LocalDate.now(clock), WarningThresholds.defaults());
    }

    public static List<Warning> detect(List<AttendanceRecord> records, LocalDate today) {
        return detect(records, today, WarningThresholds.defaults());
    }

    /**
     * @param records    attendance history in any order; null treated as empty
     * @param today      evaluation date
     * @param thresholds rule limits
     * @return fired warnings, possibly empty; never null
     */
    public static List<Warning> detect(List<AttendanceRecord> records,
                                       LocalDate today,
                                       WarningThresholds thresholds) {
        if (records == null || records.isEmpty()) return List.of();

        List<AttendanceRecord> sorted = records.stream()
            .filter(Objects::nonNull)
            .filter(r -> r.date() != null && r.status() != null)
            .sorted(Comparator.comparing(AttendanceRecord::date).reversed())
            .toList();
        if (sorted.isEmpty()) return List.of();

        List<AttendanceRecord> recent = trailingWindow(sorted, today, thresholds.recentWindowDays());

        List<Warning> warnings = new ArrayList<>(WarningTrigger.values().length);
        consecutiveMisses(sorted, thresholds).ifPresent(warnings::add);
        lowAttendanceRate(recent, thresholds).ifPresent(warnings::add);
        repeatedRejections(sorted, thresholds).ifPresent(warnings::add);
        lowQualityAverage(recent, thresholds).ifPresent(warnings::add);
        inactivity(sorted, today, thresholds).ifPresent(warnings::add);
        return List.copyOf(warnings);
    }

    // ── Rules ───────────────────────────────────────────────────────────────
    // All rules take records sorted newest-first.

    static Optional<Warning> consecutiveMisses(List<AttendanceRecord> newestFirst,
                                               WarningThresholds thresholds) {
        int run = 0;
        for (AttendanceRecord record : newestFirst) {
            if (!record.is(AttendanceStatus.MISSED)) break;
            run++;
        }
        return run >= thresholds.consecutiveMisses()
            ? Optional.of(Warning.of(WarningTrigger.CONSECUTIVE_MISSES, run))
            : Optional.empty();
    }

    static Optional<Warning> lowAttendanceRate(List<AttendanceRecord> recent,
                                               WarningThresholds thresholds) {
        if (recent.size() < thresholds.minRecentRecords()) return Optional.empty();

        long approved = recent.stream().filter(r -> r.is(AttendanceStatus.APPROVED)).count();
        long rate = Math.round(approved * 100.0 / recent.size());
        return rate < thresholds.minAttendanceRate()
            ? Optional.of(Warning.of(WarningTrigger.LOW_ATTENDANCE_RATE, rate))
            : Optional.empty();
    }

    static Optional<Warning> repeatedRejections(List<AttendanceRecord> newestFirst,
                                                WarningThresholds thresholds) {
        long rejections = newestFirst.stream()
            .limit(thresholds.rejectionLookback())
            .filter(r -> r.is(AttendanceStatus.REJECTED))
            .count();
        return rejections >= thresholds.maxRejections()
            ? Optional.of(Warning.of(WarningTrigger.REPEATED_REJECTIONS, rejections))
            : Optional.empty();
    }

    static Optional<Warning> lowQualityAverage(List<AttendanceRecord> recent,
                                               WarningThresholds thresholds) {
        OptionalDouble average = QualityRatings.average(recent);
        if (average.isEmpty() || average.getAsDouble() >= thresholds.minQualityAverage()) {
            return Optional.empty();
        }
        return Optional.of(Warning.of(WarningTrigger.LOW_QUALITY_AVG, average.getAsDouble()));
    }

    static Optional<Warning> inactivity(List<AttendanceRecord> newestFirst,
                                        LocalDate today,
                                        WarningThresholds thresholds) {
        return newestFirst.stream()
            .filter(r -> !r.is(AttendanceStatus.MISSED))
            .findFirst()
            .map(last -> ChronoUnit.DAYS.between(last.date(), today))
            .filter(days -> days >= thresholds.inactivityDays())
            .map(days -> Warning.of(WarningTrigger.WEEK_WITHOUT_SUBMISSION, days));
    }

    /** Records dated on or after {@code today − days}. */
    static List<AttendanceRecord> trailingWindow(List<AttendanceRecord> records,
                                                 LocalDate today,
                                                 int days) {
        LocalDate since = today.minusDays(days);
        return records.stream()
            .filter(r -> !r.date().isBefore(since))
            .toList();
    }
}
