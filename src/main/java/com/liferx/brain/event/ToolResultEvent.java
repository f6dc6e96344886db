package com.liferx.brain.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Sanitized outcome of a tool call. On failure data is {"error": message}
 * and explainability is {"error_code": code}.
 */
public record ToolResultEvent(String tool, JsonNode data, JsonNode explainability, boolean error)
        implements StreamEvent {
}
