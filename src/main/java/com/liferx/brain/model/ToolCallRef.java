package com.liferx.brain.model;

/**
 * A complete tool call requested by the model, assembled from stream fragments.
 * rawArguments is the JSON text exactly as streamed, possibly malformed.
 */
public record ToolCallRef(String id, String name, String rawArguments) {

    public boolean isValid() {
        return id != null && !id.isEmpty() && name != null && !name.isEmpty();
    }
}
