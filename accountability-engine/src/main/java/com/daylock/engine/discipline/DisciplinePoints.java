package com.daylock.engine.discipline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bounded discipline score with its itemised breakdown.
 *
 * <p>{@code total} is the breakdown sum floored at 0; the breakdown itself is raw and
 * may add up to a negative number.
 */
public record DisciplinePoints(
    @JsonProperty("total")     int total,
    @JsonProperty("breakdown") Breakdown breakdown,
    @JsonProperty("level")     int level,
    @JsonProperty("title")     String title
) {

    public record Breakdown(
        @JsonProperty("approved")    int approved,
        @JsonProperty("streakBonus") int streakBonus,
        @JsonProperty("missed")      int missed,
        @JsonProperty("rejected")    int rejected,
        @JsonProperty("reflections") int reflections
    ) {
        public int rawSum() {
            return approved + streakBonus + missed + rejected + reflections;
        }
    }
}
