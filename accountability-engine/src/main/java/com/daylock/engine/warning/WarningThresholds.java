package com.daylock.engine.warning;

/**
 * Tunable limits for {@link WarningDetector}. {@link #defaults()} carries the production
 * values; rooms do not override them yet.
 *
 * @param consecutiveMisses   leading missed run that fires CONSECUTIVE_MISSES
 * @param recentWindowDays    trailing window for the rate and quality rules
 * @param minRecentRecords    records the trailing window needs before the rate is judged
 * @param minAttendanceRate   rate (%) below which LOW_ATTENDANCE_RATE fires
 * @param rejectionLookback   most recent records inspected for rejections
 * @param maxRejections       rejections within the lookback that fire REPEATED_REJECTIONS
 * @param minQualityAverage   mean rating below which LOW_QUALITY_AVG fires
 * @param inactivityDays      days since the last non-missed record that fire WEEK_WITHOUT_SUBMISSION
 */
public record WarningThresholds(
    int    consecutiveMisses,
    int    recentWindowDays,
    int    minRecentRecords,
    int    minAttendanceRate,
    int    rejectionLookback,
    int    maxRejections,
    double minQualityAverage,
    int    inactivityDays
) {

    public static final int    CONSECUTIVE_MISSES  = 3;
    public static final int    RECENT_WINDOW_DAYS  = 14;
    public static final int    MIN_RECENT_RECORDS  = 5;
    public static final int    MIN_ATTENDANCE_RATE = 50;
    public static final int    REJECTION_LOOKBACK  = 7;
    public static final int    MAX_REJECTIONS      = 3;
    public static final double MIN_QUALITY_AVERAGE = 2.0;
    public static final int    INACTIVITY_DAYS     = 7;

    private static final WarningThresholds DEFAULTS = new WarningThresholds(
        CONSECUTIVE_MISSES, RECENT_WINDOW_DAYS, MIN_RECENT_RECORDS, MIN_ATTENDANCE_RATE,
        REJECTION_LOOKBACK, MAX_REJECTIONS, MIN_QUALITY_AVERAGE, INACTIVITY_DAYS);

    public static WarningThresholds defaults() {
        return DEFAULTS;
    }
}
