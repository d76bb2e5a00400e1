package com.daylock.accountability.dto;

import com.daylock.engine.escalation.ConsequenceSummary;
import com.daylock.engine.model.ConsequenceLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Suggested next tier plus the current partition. Advisory only; an operator issues the
 * consequence.
 */
public record EscalationAdvice(
    @JsonProperty("nextLevel") ConsequenceLevel nextLevel,
    @JsonProperty("summary")   ConsequenceSummary summary
) {}
