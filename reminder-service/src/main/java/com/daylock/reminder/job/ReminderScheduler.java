package com.daylock.reminder.job;

import com.daylock.engine.reminder.ReminderSchedule;
import com.daylock.reminder.client.ReminderClient;
import com.daylock.reminder.model.ReminderNotification;
import com.daylock.reminder.model.RoomReminder;
import com.daylock.reminder.sender.NotificationSink;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Arms one timer per upcoming room reminder and fires a "room opens soon" notification
 * when it elapses.
 *
 * <p>Every cycle starts from scratch:
 * <pre>
 *   dispose pending timers → fetch reminders → derive next fire times
 *     → skip fired keys and anything beyond 24h 1m → arm Mono.delay per reminder
 * </pre>
 *
 * <p>A cycle runs on startup, every {@code reminder.tick}, and on demand through
 * {@link #reschedule()} (the resume endpoint, used after host sleep or clock jumps).
 * Each tick is a fresh {@link Mono} whose terminal {@code .subscribe()} schedules the next
 * one, so a failing cycle never stops the loop.
 */
@Component
public class ReminderScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReminderScheduler.class);

    static final String DEFAULT_EMOJI = "📋";

    private final ReminderClient reminderClient;
    private final NotificationSink notificationSink;
    private final FiredReminderLedger ledger;
    private final Clock clock;
    private final Duration tick;

    private final List<Disposable> pendingTimers = new ArrayList<>();
    private volatile boolean stopped;

    public ReminderScheduler(ReminderClient reminderClient,
                             NotificationSink notificationSink,
                             FiredReminderLedger ledger,
                             Clock clock,
                             @Value("${reminder.tick:60s}") Duration tick) {
        this.reminderClient   = reminderClient;
        this.notificationSink = notificationSink;
        this.ledger           = ledger;
        this.clock            = clock;
        this.tick             = tick;
    }

    @PostConstruct
    public void start() {
        log.info("Reminder scheduler started. tickSeconds={}", tick.toSeconds());
        scheduleNextTick(Duration.ZERO);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        disposePending();
        log.info("Reminder scheduler stopped");
    }

    // ── tick loop ─────────────────────────────────────────────────────────────

    private void scheduleNextTick(Duration delay) {
        if (stopped) return;
        Mono.delay(delay)
            .then(reschedule())
            .subscribe(
                armed -> scheduleNextTick(tick),
                err -> {
                    log.error("Reminder cycle failed, retrying next tick", err);
                    scheduleNextTick(tick);
                }
            );
    }

    /**
     * Runs one scheduling cycle.
     *
     * @return number of timers armed
     */
    public Mono<Integer> reschedule() {
        return Mono.defer(() -> reminderClient.fetchAll()
            .map(reminders -> arm(reminders, LocalDateTime.now(clock))));
    }

    synchronized int arm(List<RoomReminder> reminders, LocalDateTime now) {
        disposePending();
        if (stopped) return 0;

        List<PlannedReminder> plan = planCycle(reminders, now);
        for (PlannedReminder planned : plan) {
            pendingTimers.add(Mono.delay(planned.delay())
                .subscribe(
                    t   -> fire(planned),
                    err -> log.error("Reminder timer failed. fireKey={}", planned.fireKey(), err)));
        }
        log.debug("Reminder cycle armed. reminders={} armed={}", reminders.size(), plan.size());
        return plan.size();
    }

    /**
     * Selects the occurrences to arm at {@code now}: reminders with a valid room start
     * whose next fire time is within {@link ReminderSchedule#MAX_LEAD} and whose key has not
     * fired yet.
     */
    public List<PlannedReminder> planCycle(List<RoomReminder> reminders, LocalDateTime now) {
        List<PlannedReminder> plan = new ArrayList<>();
        if (reminders == null) return plan;

        for (RoomReminder reminder : reminders) {
            if (reminder == null) continue;
            Optional<LocalTime> roomStart = reminder.roomStart();
            if (roomStart.isEmpty()) continue;

            LocalDateTime fireTime = ReminderSchedule.nextFireTime(roomStart.get(), reminder.minutesBefore(), now);
            if (!ReminderSchedule.isWithinLead(fireTime, now)) continue;

            String fireKey = ReminderSchedule.fireKey(reminder.id(), fireTime);
            if (ledger.hasFired(fireKey)) continue;

            plan.add(new PlannedReminder(reminder, fireTime, fireKey, Duration.between(now, fireTime)));
        }
        return plan;
    }

    void fire(PlannedReminder planned) {
        ledger.markFired(planned.fireKey());
        ReminderNotification notification = notificationFor(planned.reminder());
        log.info("Reminder fired. reminderId={} roomId={} fireKey={}",
                 planned.reminder().id(), planned.reminder().roomId(), planned.fireKey());
        notificationSink.send(notification);
    }

    public static ReminderNotification notificationFor(RoomReminder reminder) {
        RoomReminder.Room room = reminder.room();
        String emoji = room.emoji() == null || room.emoji().isBlank() ? DEFAULT_EMOJI : room.emoji();
        String offset = ReminderSchedule.describeOffset(reminder.minutesBefore()).replace(" before", "");
        return new ReminderNotification(
            emoji + " " + room.name() + " opens soon!",
            "Your room opens " + offset + " from now. Get ready!",
            "room-reminder-" + reminder.roomId() + "-" + reminder.minutesBefore(),
            reminder.roomId());
    }

    synchronized int pendingTimers() {
        return (int) pendingTimers.stream().filter(d -> !d.isDisposed()).count();
    }

    private synchronized void disposePending() {
        pendingTimers.forEach(Disposable::dispose);
        pendingTimers.clear();
    }
}
