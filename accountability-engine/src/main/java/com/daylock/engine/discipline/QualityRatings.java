package com.daylock.engine.discipline;

import com.daylock.engine.model.AttendanceRecord;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Reviewer quality-rating helpers shared by the warning detector and weekly aggregation.
 */
public final class QualityRatings {

    private QualityRatings() {}

    /**
     * Mean of the valid ratings, rounded to one decimal place.
     *
     * @return empty when no record carries a valid rating
     */
    public static OptionalDouble average(List<AttendanceRecord> records) {
        if (records == null) return OptionalDouble.empty();
        OptionalDouble mean = records.stream()
            .filter(Objects::nonNull)
            .filter(AttendanceRecord::hasQualityRating)
            .mapToInt(AttendanceRecord::qualityRating)
            .average();
        return mean.isPresent() ? OptionalDouble.of(roundOneDecimal(mean.getAsDouble())) : mean;
    }

    public static double roundOneDecimal(double value) {
        return Math.round(value * 10) / 10.0;
    }

    /** Display label for a 1–5 rating. Anything else reads as {@link Level#AVERAGE}. */
    public enum Level {
        POOR(1, "Poor"),
        BELOW_AVERAGE(2, "Below Average"),
        AVERAGE(3, "Average"),
        GOOD(4, "Good"),
        EXCELLENT(5, "Excellent");

        private final int rating;
        private final String label;

        Level(int rating, String label) {
            this.rating = rating;
            this.label  = label;
        }

        public int rating()   { return rating; }
        public String label() { return label; }

        public static Level of(Integer rating) {
            if (rating == null) return AVERAGE;
            for (Level level : values()) {
                if (level.rating == rating) return level;
            }
            return AVERAGE;
        }
    }
}
