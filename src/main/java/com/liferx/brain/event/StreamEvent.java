package com.liferx.brain.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Events streamed to the client during one assistant run.
 * The "type" discriminator is written by Jackson from the subtype name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DeltaEvent.class,      name = "delta"),
    @JsonSubTypes.Type(value = ToolStartEvent.class,  name = "tool_start"),
    @JsonSubTypes.Type(value = ToolResultEvent.class, name = "tool_result"),
    @JsonSubTypes.Type(value = FinalEvent.class,      name = "final")
})
public interface StreamEvent {
}
