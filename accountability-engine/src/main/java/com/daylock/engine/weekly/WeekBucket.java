package com.daylock.engine.weekly;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Attendance counts for one calendar week.
 *
 * @param rate       approved share of {@code total}, rounded to a whole percent
 * @param avgQuality mean valid rating to one decimal; null when the week has none
 */
public record WeekBucket(
    @JsonProperty("weekStart")  LocalDate weekStart,
    @JsonProperty("total")      int total,
    @JsonProperty("approved")   int approved,
    @JsonProperty("rejected")   int rejected,
    @JsonProperty("missed")     int missed,
    @JsonProperty("rate")       int rate,
    @JsonProperty("avgQuality") Double avgQuality
) {

    public static final int DAYS_PER_WEEK = 7;

    /** Last day covered by this bucket, inclusive. */
    @JsonIgnore
    public LocalDate weekEnd() {
        return weekStart.plusDays(DAYS_PER_WEEK - 1);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(weekStart) && !date.isAfter(weekEnd());
    }
}
