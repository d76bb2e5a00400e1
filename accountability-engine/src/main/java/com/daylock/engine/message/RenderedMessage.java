package com.daylock.engine.message;

import com.daylock.engine.window.Urgency;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RenderedMessage(
    @JsonProperty("text")    String text,
    @JsonProperty("urgency") Urgency urgency
) {}
