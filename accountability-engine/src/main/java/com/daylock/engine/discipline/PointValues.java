package com.daylock.engine.discipline;

/**
 * Point table used by {@link DisciplineScorer}.
 *
 * @param approved          per approved record
 * @param missed            per missed record (negative)
 * @param rejected          per rejected record (negative)
 * @param reflection        per missed record carrying a reflection; added on top of {@code missed}
 * @param streakBonusPerDay multiplied by the current streak, recomputed on every call
 * @param reflectionMinLength minimum note length that counts as a reflection
 */
public record PointValues(
    int approved,
    int missed,
    int rejected,
    int reflection,
    int streakBonusPerDay,
    int reflectionMinLength
) {

    public static final int APPROVED             = 10;
    public static final int MISSED               = -15;
    public static final int REJECTED             = -5;
    public static final int REFLECTION           = 5;
    public static final int STREAK_BONUS_PER_DAY = 2;
    public static final int REFLECTION_MIN_LENGTH = 20;

    private static final PointValues DEFAULTS = new PointValues(
        APPROVED, MISSED, REJECTED, REFLECTION, STREAK_BONUS_PER_DAY, REFLECTION_MIN_LENGTH);

    public static PointValues defaults() {
        return DEFAULTS;
    }
}
