package com.daylock.reminder.controller;

import com.daylock.reminder.job.ReminderScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/reminders")
public class ReminderController {

    private static final Logger log = LoggerFactory.getLogger(ReminderController.class);

    private final ReminderScheduler reminderScheduler;

    public ReminderController(ReminderScheduler reminderScheduler) {
        this.reminderScheduler = reminderScheduler;
    }

    /** Re-runs a scheduling cycle immediately, e.g. after the host wakes from sleep. */
    @PostMapping("/resume")
    public Mono<ResponseEntity<Map<String, Integer>>> resume() {
        log.info("Reminder resume requested");
        return reminderScheduler.reschedule()
            .map(armed -> ResponseEntity.ok(Map.of("armed", armed)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
