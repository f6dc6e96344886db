package com.liferx.brain.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-request execution context threaded through every tool invocation.
 * Immutable for the lifetime of one request.
 */
@Value
@Builder
public class ToolContext {

    String orgId;
    String sessionId;

    /** Absent for anonymous or internal callers */
    String userId;

    /** If false, tools with writes=true are rejected before validation */
    boolean allowWrites;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
