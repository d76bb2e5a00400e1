package com.daylock.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * One attendance entry per (room, user, calendar date).
 *
 * <p>Snapshots are owned by the persistence collaborator; the engine only reads them.
 * A missed record whose note is long enough doubles as the user's reflection on the miss.
 */
public record AttendanceRecord(
    @JsonProperty("date")          LocalDate date,
    @JsonProperty("status")        AttendanceStatus status,
    @JsonProperty("qualityRating") Integer qualityRating,
    @JsonProperty("note")          String note
) {

    public static final int MIN_QUALITY = 1;
    public static final int MAX_QUALITY = 5;

    public static AttendanceRecord of(LocalDate date, AttendanceStatus status) {
        return new AttendanceRecord(date, status, null, null);
    }

    /** True when a rating in {@value #MIN_QUALITY}–{@value #MAX_QUALITY} is present. */
    @JsonIgnore
    public boolean hasQualityRating() {
        return qualityRating != null
            && qualityRating >= MIN_QUALITY
            && qualityRating <= MAX_QUALITY;
    }

    @JsonIgnore
    public int noteLength() {
        return note == null ? 0 : note.length();
    }

    @JsonIgnore
    public boolean is(AttendanceStatus expected) {
        return status == expected;
    }
}
