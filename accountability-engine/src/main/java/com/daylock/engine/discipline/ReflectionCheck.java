package com.daylock.engine.discipline;

import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.AttendanceStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Finds recent misses and rejections the user still owes a written reflection for.
 */
public final class ReflectionCheck {

    private ReflectionCheck() {}

    /**
     * Records dated today or yesterday, missed or rejected, whose note is absent or
     * shorter than the reflection minimum. Input order is preserved.
     */
    public static List<AttendanceRecord> pendingReflections(List<AttendanceRecord> records,
                                                            LocalDate today) {
        return pendingReflections(records, today, PointValues.defaults());
    }

    public static List<AttendanceRecord> pendingReflections(List<AttendanceRecord> records,
                                                            LocalDate today,
                                                            PointValues values) {
        if (records == null || records.isEmpty()) return List.of();
        LocalDate yesterday = today.minusDays(1);
        return records.stream()
            .filter(Objects::nonNull)
            .filter(r -> today.equals(r.date()) || yesterday.equals(r.date()))
            .filter(r -> r.is(AttendanceStatus.MISSED) || r.is(AttendanceStatus.REJECTED))
            .filter(r -> !DisciplineScorer.isReflection(r, values))
            .toList();
    }
}
