package com.daylock.accountability.dto;

import com.daylock.engine.discipline.DisciplinePoints;
import com.daylock.engine.message.RenderedMessage;
import com.daylock.engine.model.AttendanceRecord;
import com.daylock.engine.streak.StreakPhase;
import com.daylock.engine.streak.StreakState;
import com.daylock.engine.warning.Warning;
import com.daylock.engine.weekly.WeekBucket;
import com.daylock.engine.weekly.WeeklyTrend;
import com.daylock.engine.window.WindowStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Full accountability picture for one member of one room, computed on request and never
 * stored.
 *
 * <p>{@code window} and {@code message} are only present when the request carried the
 * room's window; {@code qualityAverage} only when at least one record is rated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountabilityReport(
    @JsonProperty("roomId")             String roomId,
    @JsonProperty("userId")             String userId,
    @JsonProperty("evaluatedOn")        LocalDate evaluatedOn,
    @JsonProperty("streak")             StreakState streak,
    @JsonProperty("phase")              StreakPhase phase,
    @JsonProperty("points")             DisciplinePoints points,
    @JsonProperty("qualityAverage")     Double qualityAverage,
    @JsonProperty("warnings")           List<Warning> warnings,
    @JsonProperty("escalation")         EscalationAdvice escalation,
    @JsonProperty("weeks")              List<WeekBucket> weeks,
    @JsonProperty("trend")              WeeklyTrend trend,
    @JsonProperty("window")             WindowStatus window,
    @JsonProperty("message")            RenderedMessage message,
    @JsonProperty("pendingReflections") List<AttendanceRecord> pendingReflections
) {}
