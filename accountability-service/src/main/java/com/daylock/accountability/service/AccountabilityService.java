package com.daylock.accountability.service;

import com.daylock.accountability.dto.AccountabilityReport;
import com.daylock.accountability.dto.EscalationAdvice;
import com.daylock.accountability.dto.ReportRequest;
import com.daylock.accountability.dto.WindowRequest;
import com.daylock.engine.discipline.DisciplinePoints;
import com.daylock.engine.discipline.DisciplineScorer;
import com.daylock.engine.discipline.QualityRatings;
import com.daylock.engine.discipline.ReflectionCheck;
import com.daylock.engine.escalation.EscalationStateMachine;
import com.daylock.engine.message.PressureContext;
import com.daylock.engine.message.PressureMessages;
import com.daylock.engine.message.RenderedMessage;
import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.model.AttendanceStatus;
import com.daylock.engine.model.Consequence;
import com.daylock.engine.streak.StreakPhase;
import com.daylock.engine.streak.StreakState;
import com.daylock.engine.streak.StreakTracker;
import com.daylock.engine.warning.Warning;
import com.daylock.engine.warning.WarningDetector;
import com.daylock.engine.warning.WarningThresholds;
import com.daylock.engine.weekly.WeekBucket;
import com.daylock.engine.weekly.WeeklyAggregator;
import com.daylock.engine.window.Urgency;
import com.daylock.engine.window.WindowEvaluator;
import com.daylock.engine.window.WindowStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Runs every engine calculation for one member of one room.
 *
 * <p>Stateless apart from its configuration: each call builds a fresh
 * {@link EvaluationContext} from the injected {@link Clock}, so two concurrent reports
 * never share a "today". Nothing is persisted; the caller owns records and consequences.
 */
@Service
public class AccountabilityService {

    private static final Logger log = LoggerFactory.getLogger(AccountabilityService.class);

    private final Clock clock;
    private final WarningThresholds thresholds;
    private final DayOfWeek firstDayOfWeek;

    public AccountabilityService(Clock clock,
                                 WarningThresholds thresholds,
                                 @Value("${accountability.week-start:SUNDAY}") DayOfWeek firstDayOfWeek) {
        this.clock          = clock;
        this.thresholds     = thresholds;
        this.firstDayOfWeek = firstDayOfWeek;
    }

    public Mono<AccountabilityReport> report(ReportRequest request) {
        return Mono.fromSupplier(() -> evaluate(request, contextFor(request.roomId(), request.userId())));
    }

    public Mono<WindowStatus> window(WindowRequest request) {
        return Mono.fromSupplier(() -> {
            EvaluationContext ctx = contextFor(null, null);
            return WindowEvaluator.evaluate(request.start(), request.end(), ctx.now());
        });
    }

    public Mono<EscalationAdvice> escalation(List<Consequence> consequences) {
        return Mono.fromSupplier(() -> advise(consequences, contextFor(null, null)));
    }

    public EvaluationContext contextFor(String roomId, String userId) {
        return EvaluationContext.of(roomId, userId, clock, thresholds, firstDayOfWeek);
    }

    // ── evaluation ────────────────────────────────────────────────────────────

    public AccountabilityReport evaluate(ReportRequest request, EvaluationContext ctx) {
        List<AttendanceRecord> records = request.records() == null ? List.of() : request.records();

        StreakState streak      = StreakTracker.calculate(records, ctx.today());
        DisciplinePoints points = DisciplineScorer.calculate(records, streak.current());
        OptionalDouble quality  = QualityRatings.average(records);
        List<Warning> warnings  = WarningDetector.detect(records, ctx.today(), ctx.thresholds());
        List<WeekBucket> weeks  = WeeklyAggregator.aggregate(records, ctx.firstDayOfWeek());
        List<AttendanceRecord> pending = ReflectionCheck.pendingReflections(records, ctx.today());

        WindowStatus window     = null;
        RenderedMessage message = null;
        if (request.window() != null) {
            window = WindowEvaluator.evaluate(request.window().start(), request.window().end(), ctx.now());
            if (window.urgency() != Urgency.NONE) {
                message = pressureMessage(records, streak, window, !pending.isEmpty(), ctx);
            }
        }

        if (!warnings.isEmpty()) {
            log.info("Warnings detected. roomId={} userId={} triggers={}",
                     ctx.roomId(), ctx.userId(), warnings.stream().map(Warning::trigger).toList());
        }
        log.debug("Report computed. roomId={} userId={} streak={} points={} records={}",
                  ctx.roomId(), ctx.userId(), streak.current(), points.total(), records.size());

        return new AccountabilityReport(
            request.roomId(),
            request.userId(),
            ctx.today(),
            streak,
            StreakPhase.of(streak.current()),
            points,
            quality.isPresent() ? quality.getAsDouble() : null,
            warnings,
            advise(request.consequences(), ctx),
            weeks,
            WeeklyAggregator.computeTrend(weeks),
            window,
            message,
            pending);
    }

    EscalationAdvice advise(List<Consequence> consequences, EvaluationContext ctx) {
        return new EscalationAdvice(
            EscalationStateMachine.nextLevel(consequences, ctx.instant()),
            EscalationStateMachine.summarize(consequences, ctx.instant()));
    }

    /**
     * Wording rotates once per minute of the day. A rejected proof does not count as a
     * submission; only an approved one completes the room.
     */
    private static RenderedMessage pressureMessage(List<AttendanceRecord> records,
                                                   StreakState streak,
                                                   WindowStatus window,
                                                   boolean reflectionsPending,
                                                   EvaluationContext ctx) {
        PressureContext pressure = PressureContext.forRoom(window,
            submittedOn(records, ctx.today()),
            streak.current(),
            streak.lastStreak(),
            approvedOn(records, ctx.today()),
            reflectionsPending);
        return PressureMessages.select(pressure, ctx.now().getHour() * 60 + ctx.now().getMinute());
    }

    private static boolean submittedOn(List<AttendanceRecord> records, LocalDate day) {
        return records.stream()
            .anyMatch(r -> r != null && day.equals(r.date()) && r.status() != null
                        && !r.is(AttendanceStatus.REJECTED));
    }

    private static boolean approvedOn(List<AttendanceRecord> records, LocalDate day) {
        return records.stream()
            .anyMatch(r -> r != null && day.equals(r.date()) && r.is(AttendanceStatus.APPROVED));
    }
}
