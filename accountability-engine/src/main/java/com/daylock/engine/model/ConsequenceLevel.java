package com.daylock.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Totally ordered sanction tiers, mildest first. Declaration order is the severity order;
 * {@link #severity()} is the 1-based tier index.
 */
public enum ConsequenceLevel {
    WARNING("warning", "Warning"),
    STRIKE("strike", "Strike"),
    PROBATION("probation", "Probation"),
    FINAL_WARNING("final_warning", "Final Warning"),
    REMOVAL("removal", "Removal");

    private final String code;
    private final String label;

    ConsequenceLevel(String code, String label) {
        this.code  = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    /** 1 (warning) … 5 (removal). */
    public int severity() {
        return ordinal() + 1;
    }

    public boolean isMoreSevereThan(ConsequenceLevel other) {
        return other == null || ordinal() > other.ordinal();
    }

    public static ConsequenceLevel highest() {
        return REMOVAL;
    }

    @JsonCreator
    public static ConsequenceLevel fromCode(String code) {
        for (ConsequenceLevel level : values()) {
            if (level.code.equalsIgnoreCase(code) || level.name().equalsIgnoreCase(code)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown consequence level: " + code);
    }
}
