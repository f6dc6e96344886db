package com.liferx.brain.event;

/**
 * Announces a tool call. Deliberately carries only the tool name: arguments
 * may contain user data and are never sent to the client.
 */
public record ToolStartEvent(String tool) implements StreamEvent {
}
