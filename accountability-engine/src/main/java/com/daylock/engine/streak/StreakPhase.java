package com.daylock.engine.streak;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.util.Optional;
import java.util.Set;

/**
 * Identity phase a user earns from the length of their current streak.
 *
 * <pre>
 *   START_TODAY   0
 *   NEWCOMER      1 – 2
 *   BUILDING      3 – 6
 *   COMMITTED     7 – 13
 *   WARRIOR      14 – 29
 *   DISCIPLINED  30 – 59
 *   ELITE        60 – 99
 *   LEGEND      100+
 * </pre>
 */
@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum StreakPhase {
    START_TODAY(0, 0, "Start Today", "⚡"),
    NEWCOMER(1, 2, "Newcomer", "🌱"),
    BUILDING(3, 6, "Building", "🔨"),
    COMMITTED(7, 13, "Committed", "💪"),
    WARRIOR(14, 29, "Warrior", "⚔️"),
    DISCIPLINED(30, 59, "Disciplined", "🎯"),
    ELITE(60, 99, "Elite", "🏆"),
    LEGEND(100, Integer.MAX_VALUE, "Legend", "👑");

    /** Streak lengths celebrated with a milestone message. */
    private static final Set<Integer> MILESTONES = Set.of(3, 7, 14, 30, 60, 100);

    private final int min;
    private final int max;
    private final String label;
    private final String emoji;

    StreakPhase(int min, int max, String label, String emoji) {
        this.min   = min;
        this.max   = max;
        this.label = label;
        this.emoji = emoji;
    }

    public int getMin()      { return min; }
    public int getMax()      { return max; }
    public String getLabel() { return label; }
    public String getEmoji() { return emoji; }

    public static StreakPhase of(int streak) {
        int s = Math.max(0, streak);
        for (StreakPhase phase : values()) {
            if (s >= phase.min && s <= phase.max) return phase;
        }
        return START_TODAY;
    }

    public Optional<StreakPhase> next() {
        StreakPhase[] all = values();
        return ordinal() + 1 < all.length ? Optional.of(all[ordinal() + 1]) : Optional.empty();
    }

    /** Percentage (0–100) of the way through the streak's current phase; 100 at the top phase. */
    public static int progressPercent(int streak) {
        int s = Math.max(0, streak);
        StreakPhase current = of(s);
        if (current == LEGEND) return 100;
        int range = current.max - current.min + 1;
        int progress = s - current.min;
        return Math.min(100, (int) Math.round(progress * 100.0 / range));
    }

    /** Days left until the next phase is reached; 0 at the top phase. */
    public static int daysToNext(int streak) {
        int s = Math.max(0, streak);
        return of(s).next().map(next -> next.min - s).orElse(0);
    }

    public static boolean isMilestone(int streak) {
        return MILESTONES.contains(streak);
    }
}
