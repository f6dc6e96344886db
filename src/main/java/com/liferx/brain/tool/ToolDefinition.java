package com.liferx.brain.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Contract every tool must implement.
 *
 * Validation and execution are split so the executor can gate writes and
 * reject bad input before any business logic runs:
 * <ul>
 *   <li>{@link #validateArgs} must be pure and fail fast with a descriptive message</li>
 *   <li>{@link #run} may have side effects only when {@link #isWrites()} is true</li>
 * </ul>
 *
 * @param <A> the typed, validated argument record for this tool
 */
public interface ToolDefinition<A> {

    /** Unique dotted name the model uses to invoke this tool, e.g. "brain.search_items" */
    String getName();

    /** Primary signal the model uses to decide when to call this tool */
    String getDescription();

    /** True if {@link #run} mutates persistent state */
    boolean isWrites();

    /** JSON Schema (as a Map) describing the tool's input parameters */
    Map<String, Object> getInputSchema();

    /**
     * Parse raw JSON arguments into the tool's typed argument record.
     *
     * @param raw arguments as sent by the caller, may be a JSON null
     * @throws ToolValidationException with a message fit to show the model
     */
    A validateArgs(JsonNode raw) throws ToolValidationException;

    /**
     * Execute with already-validated arguments. Any exception thrown here is
     * converted to an EXECUTION_ERROR result by the executor.
     */
    ToolResponse run(A args, ToolContext context) throws Exception;
}
