package com.daylock.engine.warning;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How seriously an operator should take a detected pattern. A warning is never a
 * sanction by itself; {@link #STRIKE} only marks patterns worth escalating.
 */
public enum WarningSeverity {
    INFO,
    WARNING,
    STRIKE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
