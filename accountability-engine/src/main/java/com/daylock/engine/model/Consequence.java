package com.daylock.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Operator-issued sanction. Never deleted, only deactivated; the full list is the
 * audit trail. A re-offence creates a new consequence instead of reactivating an old one.
 *
 * @param expiresAt optional; only expiry-aware callers honour it
 */
public record Consequence(
    @JsonProperty("level")     ConsequenceLevel level,
    @JsonProperty("reason")    String reason,
    @JsonProperty("notes")     String notes,
    @JsonProperty("active")    boolean active,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("expiresAt") Instant expiresAt
) {

    public static Consequence issue(ConsequenceLevel level, String reason, Instant createdAt) {
        return new Consequence(level, reason, null, true, createdAt, null);
    }

    /** Active and, when an expiry is set, not yet past it. */
    @JsonIgnore
    public boolean isActiveAt(Instant now) {
        return active && (expiresAt == null || now == null || now.isBefore(expiresAt));
    }
}
