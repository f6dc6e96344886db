package com.liferx.brain.tool;

/**
 * Thrown by {@link ToolDefinition#validateArgs} when arguments are malformed
 * or violate the tool's policy. The message is returned to the model verbatim.
 */
public class ToolValidationException extends Exception {

    public ToolValidationException(String message) {
        super(message);
    }
}
