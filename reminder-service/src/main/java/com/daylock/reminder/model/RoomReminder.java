package com.daylock.reminder.model;

import com.daylock.engine.model.TimeWindow;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalTime;
import java.util.Optional;

/**
 * A user's "remind me N minutes before this room opens" setting, joined with the room
 * fields needed to schedule and word the notification.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoomReminder(
    @JsonProperty("id")             String id,
    @JsonProperty("room_id")        String roomId,
    @JsonProperty("minutes_before") int minutesBefore,
    @JsonProperty("rooms")          Room room
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Room(
        @JsonProperty("name")       String name,
        @JsonProperty("emoji")      String emoji,
        @JsonProperty("time_start") String timeStart
    ) {}

    /** The room's opening time; empty when the room is unscheduled or its time is malformed. */
    @JsonIgnore
    public Optional<LocalTime> roomStart() {
        return room == null ? Optional.empty() : TimeWindow.parseTime(room.timeStart());
    }
}
