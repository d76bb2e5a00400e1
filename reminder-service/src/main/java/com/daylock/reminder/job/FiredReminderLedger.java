package com.daylock.reminder.job;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Fire keys of reminders already delivered during this process lifetime.
 *
 * <p>Bounded: once more than {@value #MAX_KEYS} keys are held, only the newest
 * {@value #RETAINED_KEYS} are kept. Keys are per calendar occurrence, so an evicted key
 * can only matter for an occurrence that is long past.
 */
@Component
public class FiredReminderLedger {

    static final int MAX_KEYS      = 50;
    static final int RETAINED_KEYS = 30;

    private final LinkedHashSet<String> keys = new LinkedHashSet<>();

    public synchronized boolean hasFired(String fireKey) {
        return keys.contains(fireKey);
    }

    public synchronized void markFired(String fireKey) {
        keys.add(fireKey);
        if (keys.size() > MAX_KEYS) {
            List<String> ordered = new ArrayList<>(keys);
            keys.clear();
            keys.addAll(ordered.subList(ordered.size() - RETAINED_KEYS, ordered.size()));
        }
    }

    public synchronized int size() {
        return keys.size();
    }
}
