package com.daylock.engine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class ModelCodesTest {

    @Test
    @DisplayName("time windows parse HH:mm and HH:mm:ss, reject garbage")
    void parseWindow() {
        TimeWindow window = TimeWindow.parse(" 22:00 ", "02:00:00").orElseThrow();
        assertEquals(LocalTime.of(22, 0), window.start());
        assertEquals(LocalTime.of(2, 0), window.end());
        assertTrue(window.crossesMidnight());

        assertTrue(TimeWindow.parse("9am", "10:00").isEmpty());
        assertTrue(TimeWindow.parse("", "10:00").isEmpty());
        assertTrue(TimeWindow.parse("09:00", null).isEmpty());
    }

    @Test
    @DisplayName("single-digit hours parse, seconds are dropped, out-of-range hours are rejected")
    void parseSingleDigitHour() {
        assertEquals(LocalTime.of(9, 0), TimeWindow.parseTime("9:00").orElseThrow());
        assertEquals(LocalTime.of(9, 5), TimeWindow.parseTime("9:05:30").orElseThrow());
        assertEquals(LocalTime.of(21, 15), TimeWindow.parseTime("21:15").orElseThrow());
        assertTrue(TimeWindow.parseTime("25:00").isEmpty());
        assertTrue(TimeWindow.parseTime("9am").isEmpty());

        TimeWindow window = TimeWindow.parse("9:00", "17:30").orElseThrow();
        assertEquals(LocalTime.of(9, 0), window.start());
        assertFalse(window.crossesMidnight());
    }

    @Test
    @DisplayName("equal bounds are not schedulable")
    void equalBounds() {
        TimeWindow window = new TimeWindow(LocalTime.NOON, LocalTime.NOON);
        assertFalse(window.isSchedulable());
        assertFalse(window.crossesMidnight());
    }

    @Test
    @DisplayName("attendance status codes")
    void statusCodes() {
        assertEquals(AttendanceStatus.PENDING_REVIEW, AttendanceStatus.fromCode("pending_review"));
        assertEquals(AttendanceStatus.MISSED, AttendanceStatus.fromCode("MISSED"));
        assertEquals("approved", AttendanceStatus.APPROVED.code());
        assertThrows(IllegalArgumentException.class, () -> AttendanceStatus.fromCode("late"));
    }

    @Test
    @DisplayName("quality ratings outside 1..5 read as absent")
    void qualityRange() {
        LocalDate day = LocalDate.of(2024, 3, 15);
        assertTrue(new AttendanceRecord(day, AttendanceStatus.APPROVED, 5, null).hasQualityRating());
        assertFalse(new AttendanceRecord(day, AttendanceStatus.APPROVED, 6, null).hasQualityRating());
        assertFalse(AttendanceRecord.of(day, AttendanceStatus.APPROVED).hasQualityRating());
    }

    @Test
    @DisplayName("consequence activity honours the expiry only when set")
    void consequenceExpiry() {
        Instant created = Instant.parse("2024-03-01T00:00:00Z");
        Consequence open = Consequence.issue(ConsequenceLevel.STRIKE, "late", created);
        assertTrue(open.isActiveAt(created.plusSeconds(1_000_000)));

        Consequence expiring = new Consequence(ConsequenceLevel.STRIKE, "late", null, true,
            created, created.plusSeconds(60));
        assertTrue(expiring.isActiveAt(created.plusSeconds(59)));
        assertFalse(expiring.isActiveAt(created.plusSeconds(60)));
    }
}
