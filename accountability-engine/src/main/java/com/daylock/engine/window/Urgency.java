package com.daylock.engine.window;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency tier of a room window.
 *
 * <ul>
 *   <li>{@link #CRITICAL}, {@link #HIGH}, {@link #MEDIUM}, {@link #LOW} — window open,
 *       graded by seconds until close</li>
 *   <li>{@link #LOCKED} — window closed; no graded urgency while closed</li>
 *   <li>{@link #NONE}   — room has no usable schedule</li>
 * </ul>
 */
public enum Urgency {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    LOCKED,
    NONE;

    static final long CRITICAL_SECONDS = 300;
    static final long HIGH_SECONDS     = 900;
    static final long MEDIUM_SECONDS   = 1800;

    /** Grades an open window by the seconds left before it closes. */
    public static Urgency forRemaining(long seconds) {
        if (seconds <= CRITICAL_SECONDS) return CRITICAL;
        if (seconds <= HIGH_SECONDS)     return HIGH;
        if (seconds <= MEDIUM_SECONDS)   return MEDIUM;
        return LOW;
    }

    public boolean isPressing() {
        return this == CRITICAL || this == HIGH;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
