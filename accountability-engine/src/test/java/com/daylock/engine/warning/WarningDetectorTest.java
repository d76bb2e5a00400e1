package com.daylock.engine.warning;

import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.AttendanceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link WarningDetector}.
 */
class WarningDetectorTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    private static AttendanceRecord record(int daysAgo, AttendanceStatus status) {
        return AttendanceRecord.of(TODAY.minusDays(daysAgo), status);
    }

    private static AttendanceRecord rated(int daysAgo, int quality) {
        return new AttendanceRecord(TODAY.minusDays(daysAgo), AttendanceStatus.APPROVED, quality, null);
    }

    private static List<WarningTrigger> triggers(List<Warning> warnings) {
        return warnings.stream().map(Warning::trigger).toList();
    }

    @Nested
    @DisplayName("individual rules")
    class Rules {

        @Test
        @DisplayName("three missed in a row → consecutive misses with value 3")
        void consecutiveMisses() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                record(0, AttendanceStatus.MISSED),
                record(1, AttendanceStatus.MISSED),
                record(2, AttendanceStatus.MISSED)), TODAY);

            assertEquals(1, warnings.size());
            Warning warning = warnings.get(0);
            assertEquals(WarningTrigger.CONSECUTIVE_MISSES, warning.trigger());
            assertEquals("Consecutive Misses", warning.label());
            assertEquals(WarningSeverity.WARNING, warning.severity());
            assertEquals(3L, warning.value());
            assertEquals("3 consecutive days missed. This pattern needs attention.", warning.message());
        }

        @Test
        @DisplayName("a run interrupted by an approval does not count")
        void interruptedRun() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                record(0, AttendanceStatus.MISSED),
                record(1, AttendanceStatus.MISSED),
                record(2, AttendanceStatus.APPROVED),
                record(3, AttendanceStatus.MISSED)), TODAY);
            assertFalse(triggers(warnings).contains(WarningTrigger.CONSECUTIVE_MISSES));
        }

        @Test
        @DisplayName("2 of 5 approved in the last 14 days → low attendance rate 40")
        void lowAttendanceRate() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                record(0, AttendanceStatus.APPROVED),
                record(1, AttendanceStatus.MISSED),
                record(2, AttendanceStatus.MISSED),
                record(3, AttendanceStatus.MISSED),
                record(4, AttendanceStatus.APPROVED)), TODAY);

            assertEquals(List.of(WarningTrigger.LOW_ATTENDANCE_RATE), triggers(warnings));
            assertEquals(40L, warnings.get(0).value());
            assertEquals("Attendance rate dropped to 40%. Below acceptable threshold.", warnings.get(0).message());
        }

        @Test
        @DisplayName("fewer than five recent records → rate not judged")
        void tooFewRecentRecords() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                record(0, AttendanceStatus.APPROVED),
                record(1, AttendanceStatus.MISSED),
                record(2, AttendanceStatus.MISSED),
                record(4, AttendanceStatus.REJECTED)), TODAY);
            assertFalse(triggers(warnings).contains(WarningTrigger.LOW_ATTENDANCE_RATE));
        }

        @Test
        @DisplayName("records older than the trailing window are ignored for the rate")
        void outsideWindow() {
            List<AttendanceRecord> records = new ArrayList<>();
            records.add(record(0, AttendanceStatus.APPROVED));
            for (int d = 20; d < 26; d++) records.add(record(d, AttendanceStatus.MISSED));
            assertFalse(triggers(WarningDetector.detect(records, TODAY))
                .contains(WarningTrigger.LOW_ATTENDANCE_RATE));
        }

        @Test
        @DisplayName("three rejections among the newest seven → strike")
        void repeatedRejections() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                record(0, AttendanceStatus.REJECTED),
                record(1, AttendanceStatus.REJECTED),
                record(2, AttendanceStatus.REJECTED)), TODAY);

            assertEquals(List.of(WarningTrigger.REPEATED_REJECTIONS), triggers(warnings));
            assertEquals(WarningSeverity.STRIKE, warnings.get(0).severity());
            assertEquals(3L, warnings.get(0).value());
        }

        @Test
        @DisplayName("rejections beyond the seven newest are not counted")
        void rejectionLookback() {
            List<AttendanceRecord> records = new ArrayList<>();
            for (int d = 0; d < 7; d++) records.add(record(d, AttendanceStatus.APPROVED));
            for (int d = 7; d < 10; d++) records.add(record(d, AttendanceStatus.REJECTED));
            assertTrue(WarningDetector.detect(records, TODAY).isEmpty());
        }

        @Test
        @DisplayName("mean rating 1.7 → low quality average")
        void lowQualityAverage() {
            List<Warning> warnings = WarningDetector.detect(List.of(
                rated(0, 1), rated(1, 2), rated(2, 2)), TODAY);

            assertEquals(List.of(WarningTrigger.LOW_QUALITY_AVG), triggers(warnings));
            assertEquals(1.7, warnings.get(0).value());
            assertEquals("Average quality rating is 1.7/5. Effort may be declining.", warnings.get(0).message());
        }

        @Test
        @DisplayName("mean rating exactly 2 does not fire")
        void qualityAtThreshold() {
            assertTrue(WarningDetector.detect(List.of(rated(0, 2), rated(1, 2)), TODAY).isEmpty());
        }

        @Test
        @DisplayName("no non-missed record for ten days → no submissions")
        void inactivity() {
            List<Warning> warnings = WarningDetector.detect(
                List.of(record(10, AttendanceStatus.APPROVED)), TODAY);

            assertEquals(List.of(WarningTrigger.WEEK_WITHOUT_SUBMISSION), triggers(warnings));
            assertEquals(WarningSeverity.STRIKE, warnings.get(0).severity());
            assertEquals(10L, warnings.get(0).value());
            assertEquals("No Submissions", warnings.get(0).label());
        }

        @Test
        @DisplayName("six quiet days is below the inactivity limit")
        void shortInactivity() {
            assertTrue(WarningDetector.detect(List.of(record(6, AttendanceStatus.APPROVED)), TODAY).isEmpty());
        }
    }

    @Test
    @DisplayName("several rules fire together in rule order")
    void ruleOrder() {
        List<Warning> warnings = WarningDetector.detect(List.of(
            record(9, AttendanceStatus.APPROVED),
            record(0, AttendanceStatus.MISSED),
            record(2, AttendanceStatus.MISSED),
            record(1, AttendanceStatus.MISSED)), TODAY);

        assertEquals(List.of(WarningTrigger.CONSECUTIVE_MISSES, WarningTrigger.WEEK_WITHOUT_SUBMISSION),
            triggers(warnings));
        assertEquals(9L, warnings.get(1).value());
    }

    @Test
    @DisplayName("empty or null history → no warnings")
    void emptyHistory() {
        assertTrue(WarningDetector.detect(List.of(), TODAY).isEmpty());
        assertTrue(WarningDetector.detect(null, TODAY).isEmpty());
    }

    @Test
    @DisplayName("healthy history → no warnings")
    void healthyHistory() {
        List<AttendanceRecord> records = new ArrayList<>();
        for (int d = 0; d < 14; d++) records.add(rated(d, 4));
        assertTrue(WarningDetector.detect(records, TODAY).isEmpty());
    }

    @Test
    @DisplayName("custom thresholds tighten the rules")
    void customThresholds() {
        WarningThresholds strict = new WarningThresholds(2, 14, 5, 50, 7, 3, 2.0, 7);
        List<Warning> warnings = WarningDetector.detect(List.of(
            record(0, AttendanceStatus.MISSED),
            record(1, AttendanceStatus.MISSED),
            record(2, AttendanceStatus.APPROVED)), TODAY, strict);

        assertEquals(List.of(WarningTrigger.CONSECUTIVE_MISSES), triggers(warnings));
        assertEquals(2L, warnings.get(0).value());
    }
}
