package com.daylock.engine.reminder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class ReminderScheduleTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 8, 0);

    @Test
    @DisplayName("fires later today when the offset time is still ahead")
    void laterToday() {
        assertEquals(LocalDateTime.of(2024, 3, 15, 8, 45),
            ReminderSchedule.nextFireTime(LocalTime.of(9, 0), 15, NOW));
    }

    @Test
    @DisplayName("rolls over to tomorrow once today's fire time has passed")
    void tomorrow() {
        assertEquals(LocalDateTime.of(2024, 3, 16, 7, 30),
            ReminderSchedule.nextFireTime(LocalTime.of(8, 30), 60, NOW));
    }

    @Test
    @DisplayName("a fire time equal to now is treated as passed")
    void exactlyNow() {
        assertEquals(LocalDateTime.of(2024, 3, 16, 8, 0),
            ReminderSchedule.nextFireTime(LocalTime.of(8, 5), 5, NOW));
    }

    @Test
    @DisplayName("an offset crossing midnight lands on the previous evening")
    void offsetCrossesMidnight() {
        LocalDateTime evening = LocalDateTime.of(2024, 3, 15, 22, 0);
        assertEquals(LocalDateTime.of(2024, 3, 15, 23, 30),
            ReminderSchedule.nextFireTime(LocalTime.of(0, 30), 60, evening));
    }

    @Test
    @DisplayName("only fire times within a day and a minute are armed")
    void lead() {
        assertTrue(ReminderSchedule.isWithinLead(NOW.plusMinutes(1), NOW));
        assertTrue(ReminderSchedule.isWithinLead(NOW.plusDays(1).plusMinutes(1), NOW));
        assertFalse(ReminderSchedule.isWithinLead(NOW.plusDays(1).plusMinutes(2), NOW));
        assertFalse(ReminderSchedule.isWithinLead(NOW.minusSeconds(1), NOW));
    }

    @Test
    @DisplayName("fire key is stable per occurrence")
    void fireKey() {
        LocalDateTime fireTime = LocalDateTime.of(2024, 3, 15, 8, 45, 30);
        assertEquals("r1-2024-03-15T08:45", ReminderSchedule.fireKey("r1", fireTime));
        assertNotEquals(ReminderSchedule.fireKey("r1", fireTime),
            ReminderSchedule.fireKey("r1", fireTime.plusDays(1)));
    }

    @Test
    @DisplayName("offset descriptions")
    void describeOffset() {
        assertEquals("15 min before", ReminderSchedule.describeOffset(15));
        assertEquals("1 hour before", ReminderSchedule.describeOffset(60));
        assertEquals("2 hours before", ReminderSchedule.describeOffset(120));
        assertEquals("1h 30m before", ReminderSchedule.describeOffset(90));
    }
}
