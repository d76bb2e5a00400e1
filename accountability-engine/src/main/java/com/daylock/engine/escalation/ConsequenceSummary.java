package com.daylock.engine.escalation;

import com.daylock.engine.model.Consequence;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Active/resolved partition of a consequence history.
 *
 * @param highest the most severe active consequence (first one listed on a tie); null when none is active
 * @param total   size of the full history, active and resolved
 */
public record ConsequenceSummary(
    @JsonProperty("active")   List<Consequence> active,
    @JsonProperty("resolved") List<Consequence> resolved,
    @JsonProperty("highest")  Consequence highest,
    @JsonProperty("total")    int total
) {

    public static final ConsequenceSummary EMPTY =
        new ConsequenceSummary(List.of(), List.of(), null, 0);

    public boolean hasActive() {
        return highest != null;
    }
}
