package com.daylock.reminder.job;

import com.daylock.reminder.model.RoomReminder;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One reminder occurrence selected for arming during a scheduling cycle.
 *
 * @param delay time from the cycle's "now" until {@code fireTime}
 */
public record PlannedReminder(
    RoomReminder  reminder,
    LocalDateTime fireTime,
    String        fireKey,
    Duration      delay
) {}
