package com.daylock.engine.streak;

import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.AttendanceStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Pure stateless derivation of {@link StreakState} from an attendance history.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Keep approved records, deduplicate by date, sort newest first.</li>
 *   <li>The streak is <em>alive</em> when the newest approved date is today or
 *       yesterday, allowing one day of grace before an unrecorded day counts as a break.</li>
 *   <li>A run continues while consecutive entries are exactly one day apart.</li>
 * </ol>
 *
 * <p>No I/O. No Spring dependency. Input order does not matter.
 */
public final class StreakTracker {

    private StreakTracker() {}

    public static StreakState calculate(List<AttendanceRecord> records, Clock clock) {
        return calculate(records, LocalDate.now(clock));
    }

    /**
     * @param records full history for one room+user, any order; null treated as empty
     * @param today   the evaluation date
     * @return the streak state; never null
     */
    public static StreakState calculate(List<AttendanceRecord> records, LocalDate today) {
        if (records == null || records.isEmpty()) return StreakState.NONE;

        List<LocalDate> approvedDates = records.stream()
            .filter(Objects::nonNull)
            .filter(r -> r.is(AttendanceStatus.APPROVED) && r.date() != null)
            .map(AttendanceRecord::date)
            .distinct()
            .sorted(Comparator.reverseOrder())
            .toList();

        if (approvedDates.isEmpty()) return StreakState.NONE;

        LocalDate newest = approvedDates.get(0);
        boolean alive = newest.equals(today) || newest.equals(today.minusDays(1));

        int mostRecentRun = runLengthFrom(approvedDates, 0);
        int longest = longestRun(approvedDates);

        int current    = alive ? mostRecentRun : 0;
        int lastStreak = alive ? 0 : mostRecentRun;

        return new StreakState(current, Math.max(longest, current), lastStreak);
    }

    /** Length of the consecutive-day run starting at {@code from} (descending dates). */
    static int runLengthFrom(List<LocalDate> descending, int from) {
        int run = 1;
        for (int i = from + 1; i < descending.size(); i++) {
            if (!isNextDayBefore(descending.get(i - 1), descending.get(i))) break;
            run++;
        }
        return run;
    }

    static int longestRun(List<LocalDate> descending) {
        int longest = 0;
        int run = 1;
        for (int i = 1; i < descending.size(); i++) {
            if (isNextDayBefore(descending.get(i - 1), descending.get(i))) {
                run++;
            } else {
                longest = Math.max(longest, run);
                run = 1;
            }
        }
        return Math.max(longest, run);
    }

    private static boolean isNextDayBefore(LocalDate later, LocalDate earlier) {
        return ChronoUnit.DAYS.between(earlier, later) == 1;
    }
}
