package com.daylock.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a single day's attendance in a room.
 *
 * <ul>
 *   <li>{@link #APPROVED}       — proof accepted by the room's reviewer</li>
 *   <li>{@link #REJECTED}       — proof submitted but refused</li>
 *   <li>{@link #MISSED}         — no proof before the window closed</li>
 *   <li>{@link #PENDING_REVIEW} — proof submitted, not yet reviewed</li>
 * </ul>
 */
public enum AttendanceStatus {
    APPROVED("approved"),
    REJECTED("rejected"),
    MISSED("missed"),
    PENDING_REVIEW("pending_review");

    private final String code;

    AttendanceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a wire code ({@code "approved"}, {@code "pending_review"}, …).
     * Enum names are accepted as well.
     *
     * @throws IllegalArgumentException for unknown codes
     */
    @JsonCreator
    public static AttendanceStatus fromCode(String code) {
        for (AttendanceStatus status : values()) {
            if (status.code.equalsIgnoreCase(code) || status.name().equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown attendance status: " + code);
    }
}
