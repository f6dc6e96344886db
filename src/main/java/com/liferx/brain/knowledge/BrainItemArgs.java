package com.liferx.brain.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.liferx.brain.tool.ToolValidationException;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Shared argument checks for the knowledge tools.
 */
public final class BrainItemArgs {

    public static final String TYPE_CHOICES = Arrays.stream(BrainItem.Type.values())
            .map(Enum::name)
            .collect(Collectors.joining(", "));

    private BrainItemArgs() {
    }

    public static boolean isValidType(String value) {
        return Arrays.stream(BrainItem.Type.values()).anyMatch(t -> t.name().equals(value));
    }

    /** Accepts a JSON null / missing node as "no arguments"; anything else must be an object */
    public static JsonNode requireObject(JsonNode raw) throws ToolValidationException {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return null;
        }
        if (!raw.isObject()) {
            throw new ToolValidationException("args must be an object");
        }
        return raw;
    }

    /** True when the field is absent or explicitly null */
    public static boolean absent(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull();
    }
}
