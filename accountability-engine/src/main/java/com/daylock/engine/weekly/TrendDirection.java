package com.daylock.engine.weekly;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DECLINING;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }
}
