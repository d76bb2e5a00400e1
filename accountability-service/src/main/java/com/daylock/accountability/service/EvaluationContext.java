package com.daylock.accountability.service;

import com.daylock.engine.warning.WarningThresholds;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Per-request evaluation state. Built once per call from the injected {@link Clock} and
 * threaded through every engine call so a single report never straddles two instants.
 *
 * @param instant  the moment of evaluation, used for consequence expiry
 * @param now      wall-clock time in {@code zone}, used for window evaluation
 * @param today    {@code now}'s date, used for streak liveness and warning windows
 */
public record EvaluationContext(
    String            roomId,
    String            userId,
    Instant           instant,
    LocalDateTime     now,
    LocalDate         today,
    ZoneId            zone,
    WarningThresholds thresholds,
    DayOfWeek         firstDayOfWeek
) {

    public static EvaluationContext of(String roomId,
                                       String userId,
                                       Clock clock,
                                       WarningThresholds thresholds,
                                       DayOfWeek firstDayOfWeek) {
        Instant instant = clock.instant();
        LocalDateTime now = LocalDateTime.ofInstant(instant, clock.getZone());
        return new EvaluationContext(roomId, userId, instant, now, now.toLocalDate(),
            clock.getZone(), thresholds, firstDayOfWeek);
    }
}
