package com.liferx.brain.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name → tool mapping.
 *
 * Built exactly once at startup through {@link #build(List)}; there is no way to
 * add or remove a tool afterwards, so concurrent requests can read it without locking.
 */
@Slf4j
public final class ToolRegistry {

    private final Map<String, ToolDefinition<?>> tools;
    private final List<ToolSchema> schemas;

    private ToolRegistry(Map<String, ToolDefinition<?>> tools) {
        this.tools = tools;
        this.schemas = tools.values().stream().map(ToolSchema::from).toList();
    }

    /**
     * @throws IllegalStateException if two tools share a name or a name is blank
     */
    public static ToolRegistry build(List<? extends ToolDefinition<?>> definitions) {
        Map<String, ToolDefinition<?>> byName = new LinkedHashMap<>();
        for (ToolDefinition<?> tool : definitions) {
            String name = tool.getName();
            if (name == null || name.isBlank()) {
                throw new IllegalStateException("Tool " + tool.getClass().getName() + " has no name");
            }
            if (byName.putIfAbsent(name, tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
            log.info("Registered tool: [{}] writes={}", name, tool.isWrites());
        }
        log.info("Total tools registered: {}", byName.size());
        return new ToolRegistry(Map.copyOf(byName));
    }

    public Optional<ToolDefinition<?>> lookup(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolSchema> schemas() {
        return schemas;
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public int size() {
        return tools.size();
    }
}
