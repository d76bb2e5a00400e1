package com.daylock.engine.reminder;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Fire-time arithmetic for "remind me N minutes before the room opens".
 *
 * <p>The scheduling collaborator re-runs {@link #nextFireTime} on every tick; the
 * {@link #fireKey} of an occurrence is stable across ticks, which is what lets it skip
 * reminders that already fired.
 */
public final class ReminderSchedule {

    /** Offsets offered to users, in minutes. */
    public static final List<Integer> PRESETS = List.of(1, 5, 10, 15, 30, 60);

    /** Timers further out than one day plus a minute are left for a later tick. */
    public static final Duration MAX_LEAD = Duration.ofDays(1).plusMinutes(1);

    private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private ReminderSchedule() {}

    /**
     * Today's {@code roomStart − minutesBefore} when that is strictly after {@code now},
     * otherwise the same offset before tomorrow's opening.
     */
    public static LocalDateTime nextFireTime(LocalTime roomStart, int minutesBefore, LocalDateTime now) {
        LocalDateTime today = now.toLocalDate().atTime(roomStart).minusMinutes(minutesBefore);
        if (today.isAfter(now)) return today;
        return now.toLocalDate().plusDays(1).atTime(roomStart).minusMinutes(minutesBefore);
    }

    /** True when a timer for {@code fireTime} should be armed now. */
    public static boolean isWithinLead(LocalDateTime fireTime, LocalDateTime now) {
        Duration lead = Duration.between(now, fireTime);
        return !lead.isNegative() && lead.compareTo(MAX_LEAD) <= 0;
    }

    /** {@code "{reminderId}-{yyyy-MM-ddTHH:mm}"}, unique per calendar occurrence. */
    public static String fireKey(String reminderId, LocalDateTime fireTime) {
        return reminderId + "-" + KEY_FORMAT.format(fireTime);
    }

    /** {@code "15 min before"}, {@code "1 hour before"}, {@code "1h 30m before"}. */
    public static String describeOffset(int minutesBefore) {
        if (minutesBefore < 60) return minutesBefore + " min before";
        int hours = minutesBefore / 60;
        int mins  = minutesBefore % 60;
        if (mins == 0) return hours + " hour" + (hours > 1 ? "s" : "") + " before";
        return hours + "h " + mins + "m before";
    }
}
