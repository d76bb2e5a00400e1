package com.daylock.accountability.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw room window bounds as stored on the room, {@code "HH:mm"} or {@code "HH:mm:ss"}.
 */
public record WindowRequest(
    @JsonProperty("start") String start,
    @JsonProperty("end")   String end
) {}
