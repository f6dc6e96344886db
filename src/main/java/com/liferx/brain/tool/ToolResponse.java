package com.liferx.brain.tool;

import lombok.Value;

import java.util.Map;

/**
 * What a tool hands back: tool-specific data plus an optional audit annotation.
 * Explainability never reaches the client unsanitized.
 */
@Value
public class ToolResponse {

    Object data;
    Map<String, Object> explainability;

    public static ToolResponse of(Object data) {
        return new ToolResponse(data, null);
    }

    public static ToolResponse of(Object data, Map<String, Object> explainability) {
        return new ToolResponse(data, explainability);
    }
}
