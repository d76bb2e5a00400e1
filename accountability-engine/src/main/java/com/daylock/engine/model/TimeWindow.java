package com.daylock.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Daily time-of-day interval during which a room accepts proof.
 *
 * <p>Midnight crossing is inferred, never declared: {@code 22:00–02:00} wraps because
 * {@code end} is not after {@code start}. Bounds may be null when the room has no schedule.
 */
public record TimeWindow(
    @JsonProperty("start") LocalTime start,
    @JsonProperty("end")   LocalTime end
) {

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("H:mm");

    /**
     * Parses {@code "HH:mm"} or {@code "HH:mm:ss"} bounds.
     *
     * @return the window, or empty when either bound is missing or malformed
     */
    public static Optional<TimeWindow> parse(String start, String end) {
        Optional<LocalTime> s = parseTime(start);
        Optional<LocalTime> e = parseTime(end);
        if (s.isEmpty() || e.isEmpty()) return Optional.empty();
        return Optional.of(new TimeWindow(s.get(), e.get()));
    }

    /** Both bounds present and distinct. */
    @JsonIgnore
    public boolean isSchedulable() {
        return start != null && end != null && !start.equals(end);
    }

    @JsonIgnore
    public boolean crossesMidnight() {
        return isSchedulable() && !end.isAfter(start);
    }

    /**
     * A single {@code "H:mm"}, {@code "HH:mm"} or {@code "HH:mm:ss"} bound; empty when missing
     * or malformed.
     */
    public static Optional<LocalTime> parseTime(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String trimmed = raw.trim();
        // Postgres "time" columns come back as HH:mm:ss; seconds are ignored.
        int secondsColon = trimmed.indexOf(':', trimmed.indexOf(':') + 1);
        if (secondsColon > 0) trimmed = trimmed.substring(0, secondsColon);
        try {
            return Optional.of(LocalTime.parse(trimmed, HOUR_MINUTE));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
