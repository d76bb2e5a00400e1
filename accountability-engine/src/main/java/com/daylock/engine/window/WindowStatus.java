package com.daylock.engine.window;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a single window evaluation. Carries both the formatted countdown and the
 * raw fields, so a display can re-render every tick without re-deriving state.
 *
 * @param timeRemaining formatted countdown; null when the room has no schedule
 * @param totalSeconds  seconds until close (open) or until the next open (closed)
 */
public record WindowStatus(
    @JsonProperty("open")          boolean open,
    @JsonProperty("timeRemaining") String timeRemaining,
    @JsonProperty("totalSeconds")  long totalSeconds,
    @JsonProperty("urgency")       Urgency urgency,
    @JsonProperty("label")         String label
) {

    public static final String LABEL_CLOSES_IN   = "Closes in";
    public static final String LABEL_OPENS_IN    = "Opens in";
    public static final String LABEL_NO_SCHEDULE = "No schedule";

    private static final WindowStatus NONE =
        new WindowStatus(false, null, 0, Urgency.NONE, LABEL_NO_SCHEDULE);

    public static WindowStatus none() {
        return NONE;
    }
}
