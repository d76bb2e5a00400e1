package com.daylock.engine.discipline;

/**
 * Discipline rank reached at a point total. Thresholds are inclusive lower bounds.
 */
public enum DisciplineLevel {
    UNRANKED(0, 0, "Unranked"),
    GETTING_STARTED(1, 10, "Getting Started"),
    PROGRESSING(2, 50, "Progressing"),
    CONSISTENT(3, 150, "Consistent"),
    UNSHAKEABLE(4, 300, "Unshakeable"),
    IRON_WILL(5, 500, "Iron Will");

    private final int level;
    private final int threshold;
    private final String title;

    DisciplineLevel(int level, int threshold, String title) {
        this.level     = level;
        this.threshold = threshold;
        this.title     = title;
    }

    public int level()     { return level; }
    public int threshold() { return threshold; }
    public String title()  { return title; }

    public static DisciplineLevel of(int points) {
        DisciplineLevel[] all = values();
        for (int i = all.length - 1; i > 0; i--) {
            if (points >= all[i].threshold) return all[i];
        }
        return UNRANKED;
    }
}
