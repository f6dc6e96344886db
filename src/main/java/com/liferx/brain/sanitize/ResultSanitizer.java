package com.liferx.brain.sanitize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.liferx.brain.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Bounds and scrubs tool output before it reaches a client or the audit log.
 *
 * Rules, applied recursively:
 * <ul>
 *   <li>nesting deeper than max-depth collapses to {@value #MAX_DEPTH_MARKER}</li>
 *   <li>long strings keep their prefix and gain a {@value #TRUNCATION_MARKER} suffix
 *       (the limit is tighter below the top level)</li>
 *   <li>arrays keep their first N items; a trailing marker element notes the cut</li>
 *   <li>values under sensitive keys become {@value #REDACTED}</li>
 * </ul>
 *
 * Output shape matches input shape: arrays stay arrays, objects stay objects,
 * null stays null. Sanitizing an already-sanitized value returns an equal value.
 */
@Component
@Slf4j
public class ResultSanitizer {

    public static final String TRUNCATION_MARKER = "...[truncated]";
    public static final String MAX_DEPTH_MARKER = "[max depth exceeded]";
    public static final String REDACTED = "[REDACTED]";
    public static final String UNSERIALIZABLE = "[unserializable]";

    private final AgentProperties.Sanitizer limits;
    private final ObjectMapper objectMapper;
    private final List<String> sensitiveKeys;
    private final List<String> sensitiveFragments;

    @Autowired
    public ResultSanitizer(AgentProperties agentProperties, ObjectMapper objectMapper) {
        this(agentProperties.getSanitizer(), objectMapper);
    }

    public ResultSanitizer(AgentProperties.Sanitizer limits, ObjectMapper objectMapper) {
        this.limits = limits;
        this.objectMapper = objectMapper;
        this.sensitiveKeys = limits.getSensitiveKeyList();
        this.sensitiveFragments = limits.getSensitiveKeyFragmentList();
    }

    /**
     * Sanitize an arbitrary value. Maps, lists, records and beans are first
     * converted to a JSON tree with the application's ObjectMapper; a value
     * that cannot be converted (cyclic graph, no serializer) becomes
     * {@value #UNSERIALIZABLE}.
     */
    public JsonNode sanitize(Object value) {
        if (value == null) return NullNode.getInstance();
        if (value instanceof JsonNode node) return sanitize(node);
        JsonNode tree;
        try {
            tree = objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            log.warn("Cannot convert {} to JSON: {}", value.getClass().getSimpleName(), e.getMessage());
            return TextNode.valueOf(UNSERIALIZABLE);
        }
        return sanitize(tree);
    }

    public JsonNode sanitize(JsonNode value) {
        return sanitize(value, 0);
    }

    private JsonNode sanitize(JsonNode node, int depth) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return NullNode.getInstance();
        }
        if (depth > limits.getMaxDepth()) {
            return TextNode.valueOf(MAX_DEPTH_MARKER);
        }
        if (node.isTextual()) {
            int max = depth == 0 ? limits.getMaxStringLength() : limits.getMaxNestedStringLength();
            return TextNode.valueOf(truncate(node.textValue(), max));
        }
        if (node.isArray()) {
            return sanitizeArray((ArrayNode) node, depth);
        }
        if (node.isObject()) {
            return sanitizeObject((ObjectNode) node, depth);
        }
        // numbers, booleans, binary
        return node;
    }

    private ArrayNode sanitizeArray(ArrayNode array, int depth) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        int keep = Math.min(array.size(), limits.getMaxArrayItems());
        for (int i = 0; i < keep; i++) {
            out.add(sanitize(array.get(i), depth + 1));
        }
        if (array.size() > keep) {
            out.add(TRUNCATION_MARKER);
        }
        return out;
    }

    private ObjectNode sanitizeObject(ObjectNode object, int depth) {
        ObjectNode out = JsonNodeFactory.instance.objectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isSensitive(field.getKey())) {
                out.put(field.getKey(), REDACTED);
            } else {
                out.set(field.getKey(), sanitize(field.getValue(), depth + 1));
            }
        }
        return out;
    }

    boolean isSensitive(String key) {
        String lower = key.toLowerCase();
        if (sensitiveKeys.contains(lower)) return true;
        for (String fragment : sensitiveFragments) {
            if (lower.contains(fragment)) return true;
        }
        return false;
    }

    private static String truncate(String s, int max) {
        if (s.length() <= max) return s;
        return s.substring(0, max) + TRUNCATION_MARKER;
    }
}
