package com.liferx.brain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FinalEvent(FinalPayload payload) implements StreamEvent {

    public record FinalPayload(String agent,
                               String content,
                               @JsonProperty("next_actions") List<String> nextActions) {
    }
}
