package com.liferx.brain.tool;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Immutable snapshot of a tool's schema sent to the model.
 * Decouples the model serialization format from the ToolDefinition implementation.
 */
@Data
@Builder
public class ToolSchema {

    private String name;
    private String description;
    private Map<String, Object> inputSchema;

    public static ToolSchema from(ToolDefinition<?> tool) {
        return ToolSchema.builder()
                .name(tool.getName())
                .description(tool.getDescription())
                .inputSchema(tool.getInputSchema())
                .build();
    }

    /**
     * OpenAI function-calling format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", inputSchema
                )
        );
    }
}
