package com.daylock.engine.weekly;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Week-over-week movement of the attendance rate.
 *
 * @param change latest week's rate minus the previous week's, in percentage points
 */
public record WeeklyTrend(
    @JsonProperty("direction") TrendDirection direction,
    @JsonProperty("change")    int change
) {

    public static final WeeklyTrend STABLE = new WeeklyTrend(TrendDirection.STABLE, 0);
}
