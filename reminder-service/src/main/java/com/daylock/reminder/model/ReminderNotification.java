package com.daylock.reminder.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound "room opens soon" notification.
 *
 * @param tag collapse key; a newer notification with the same tag replaces the older one
 */
public record ReminderNotification(
    @JsonProperty("title")  String title,
    @JsonProperty("body")   String body,
    @JsonProperty("tag")    String tag,
    @JsonProperty("roomId") String roomId
) {}
