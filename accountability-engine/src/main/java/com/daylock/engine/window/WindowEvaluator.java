package com.daylock.engine.window;

import com.daylock.engine.model.TimeWindow;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Open/closed state and countdown for a recurring daily {@link TimeWindow}.
 *
 * <h3>Midnight crossing</h3>
 * <p>Bounds are first placed on the evaluation date. When {@code end ≤ start} the window
 * wraps: if {@code now} is before today's end it belongs to the window opened yesterday
 * (start moves back a day), otherwise to tonight's window (end moves forward a day).
 *
 * <pre>
 *   22:00–02:00 @ 01:30  → open,   closes in 30m 00s
 *   22:00–02:00 @ 03:00  → closed, opens in 19h 00m
 * </pre>
 *
 * <p>Pure and idempotent: the same window and instant always give the same status.
 * Missing or equal bounds yield {@link WindowStatus#none()}; nothing here throws.
 */
public final class WindowEvaluator {

    private WindowEvaluator() {}

    public static WindowStatus evaluate(TimeWindow window, Clock clock) {
        return evaluate(window, LocalDateTime.now(clock));
    }

    /** Parses the raw bounds first; malformed bounds read as "no schedule". */
    public static WindowStatus evaluate(String start, String end, LocalDateTime now) {
        return TimeWindow.parse(start, end)
            .map(window -> evaluate(window, now))
            .orElseGet(WindowStatus::none);
    }

    /**
     * @param window the room's window; null or unschedulable yields {@link WindowStatus#none()}
     * @param now    wall-clock time in the room's zone
     */
    public static WindowStatus evaluate(TimeWindow window, LocalDateTime now) {
        if (window == null || !window.isSchedulable() || now == null) {
            return WindowStatus.none();
        }

        Bounds bounds = boundsAround(window, now);

        if (!now.isBefore(bounds.start()) && !now.isAfter(bounds.end())) {
            long remaining = secondsBetween(now, bounds.end());
            return new WindowStatus(true, formatCountdown(remaining), remaining,
                Urgency.forRemaining(remaining), WindowStatus.LABEL_CLOSES_IN);
        }

        LocalDateTime nextStart = now.isAfter(bounds.end())
            ? bounds.start().plusDays(1)
            : bounds.start();
        long untilOpen = secondsBetween(now, nextStart);
        return new WindowStatus(false, formatCountdown(untilOpen), untilOpen,
            Urgency.LOCKED, WindowStatus.LABEL_OPENS_IN);
    }

    /** Whether proof submitted at {@code now} falls inside the window. */
    public static boolean isOpen(TimeWindow window, LocalDateTime now) {
        return evaluate(window, now).open();
    }

    /**
     * {@code "2h 05m"} with hours, {@code "4m 09s"} with minutes, otherwise {@code "42s"}.
     */
    public static String formatCountdown(long totalSeconds) {
        long s = Math.max(0, totalSeconds);
        long hours   = s / 3600;
        long minutes = (s % 3600) / 60;
        long seconds = s % 60;

        if (hours > 0)   return String.format("%dh %02dm", hours, minutes);
        if (minutes > 0) return String.format("%dm %02ds", minutes, seconds);
        return seconds + "s";
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private record Bounds(LocalDateTime start, LocalDateTime end) {}

    private static Bounds boundsAround(TimeWindow window, LocalDateTime now) {
        LocalDate day = now.toLocalDate();
        LocalDateTime start = day.atTime(window.start());
        LocalDateTime end   = day.atTime(window.end());

        if (!end.isAfter(start)) {
            if (now.isBefore(end)) {
                start = start.minusDays(1);
            } else {
                end = end.plusDays(1);
            }
        }
        return new Bounds(start, end);
    }

    /** Whole seconds, floored, never negative. */
    private static long secondsBetween(LocalDateTime from, LocalDateTime to) {
        return Math.max(0, Duration.between(from, to).getSeconds());
    }
}
