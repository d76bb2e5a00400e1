package com.daylock.engine.warning;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A detected pattern. Recomputed on every evaluation and never persisted by the engine;
 * an operator who acts on it stores their own counterpart.
 *
 * @param value the observed quantity: a whole count (run length, rate %, rejections, days)
 *              or the one-decimal mean rating
 */
public record Warning(
    @JsonProperty("triggerId") WarningTrigger trigger,
    @JsonProperty("label")     String label,
    @JsonProperty("severity")  WarningSeverity severity,
    @JsonProperty("value")     Number value,
    @JsonProperty("message")   String message
) {

    static Warning of(WarningTrigger trigger, long count) {
        return new Warning(trigger, trigger.label(), trigger.severity(), count, trigger.message(count));
    }

    static Warning of(WarningTrigger trigger, double measure) {
        return new Warning(trigger, trigger.label(), trigger.severity(), measure, trigger.message(measure));
    }
}
