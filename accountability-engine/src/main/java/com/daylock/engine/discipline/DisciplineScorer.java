package com.daylock.engine.discipline;

import com.daylock.engine.model.AttendanceRecord;

import java.util.List;

/**
 * Converts an attendance history plus the current streak into {@link DisciplinePoints}.
 *
 * <h3>Point table (defaults)</h3>
 * <pre>
 *   approved     +10 per record
 *   missed       -15 per record
 *   rejected      -5 per record
 *   reflection    +5 per missed record whose note is ≥ 20 chars (on top of the miss)
 *   streak bonus  current streak × 2
 * </pre>
 *
 * <p>Pending records score nothing. The streak bonus is recomputed from the supplied
 * streak on every call, so repeated calls never compound it.
 *
 * <p>Pure function. No Spring dependency.
 */
public final class DisciplineScorer {

    private DisciplineScorer() {}

    public static DisciplinePoints calculate(List<AttendanceRecord> records, int currentStreak) {
        return calculate(records, currentStreak, PointValues.defaults());
    }

    /**
     * @param records       attendance history; null treated as empty
     * @param currentStreak typically {@code StreakTracker.calculate(..).current()}; negative treated as 0
     * @param values        point table
     * @return the scored points; never null
     */
    public static DisciplinePoints calculate(List<AttendanceRecord> records,
                                             int currentStreak,
                                             PointValues values) {
        int approved = 0;
        int missed = 0;
        int rejected = 0;
        int reflections = 0;

        if (records != null) {
            for (AttendanceRecord record : records) {
                if (record == null || record.status() == null) continue;
                switch (record.status()) {
                    case APPROVED -> approved += values.approved();
                    case REJECTED -> rejected += values.rejected();
                    case MISSED -> {
                        missed += values.missed();
                        if (isReflection(record, values)) reflections += values.reflection();
                    }
                    case PENDING_REVIEW -> { }
                }
            }
        }

        int streakBonus = Math.max(0, currentStreak) * values.streakBonusPerDay();

        DisciplinePoints.Breakdown breakdown =
            new DisciplinePoints.Breakdown(approved, streakBonus, missed, rejected, reflections);
        int total = Math.max(0, breakdown.rawSum());
        DisciplineLevel level = DisciplineLevel.of(total);

        return new DisciplinePoints(total, breakdown, level.level(), level.title());
    }

    /**
     * A missed record counts as reflected on when its note reaches the minimum length.
     * Note length is the only signal; edits to the note are not tracked.
     */
    public static boolean isReflection(AttendanceRecord record, PointValues values) {
        return record.noteLength() >= values.reflectionMinLength();
    }
}
