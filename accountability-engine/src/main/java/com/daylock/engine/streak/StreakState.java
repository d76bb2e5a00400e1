package com.daylock.engine.streak;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Streak snapshot for one room+user.
 *
 * @param current    consecutive approved days ending today or yesterday; 0 when broken
 * @param longest    longest run anywhere in the history, always ≥ {@code current}
 * @param lastStreak length of the most recent run, set only while {@code current} is 0
 */
public record StreakState(
    @JsonProperty("current")    int current,
    @JsonProperty("longest")    int longest,
    @JsonProperty("lastStreak") int lastStreak
) {

    public static final StreakState NONE = new StreakState(0, 0, 0);

    @JsonIgnore
    public boolean isAlive() {
        return current > 0;
    }
}
