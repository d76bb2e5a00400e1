package com.daylock.reminder.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FiredReminderLedgerTest {

    @Test
    @DisplayName("remembers fired keys")
    void remembers() {
        FiredReminderLedger ledger = new FiredReminderLedger();
        ledger.markFired("r1-2024-03-15T08:45");
        assertTrue(ledger.hasFired("r1-2024-03-15T08:45"));
        assertFalse(ledger.hasFired("r1-2024-03-16T08:45"));
    }

    @Test
    @DisplayName("above 50 keys only the newest 30 are kept")
    void bounded() {
        FiredReminderLedger ledger = new FiredReminderLedger();
        for (int i = 1; i <= 50; i++) ledger.markFired("key-" + i);
        assertEquals(50, ledger.size());

        ledger.markFired("key-51");
        assertEquals(FiredReminderLedger.RETAINED_KEYS, ledger.size());
        assertFalse(ledger.hasFired("key-21"));
        assertTrue(ledger.hasFired("key-22"));
        assertTrue(ledger.hasFired("key-51"));
    }

    @Test
    @DisplayName("marking the same key twice does not grow the ledger")
    void idempotent() {
        FiredReminderLedger ledger = new FiredReminderLedger();
        ledger.markFired("k");
        ledger.markFired("k");
        assertEquals(1, ledger.size());
    }
}
