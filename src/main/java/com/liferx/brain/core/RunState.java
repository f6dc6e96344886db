package com.liferx.brain.core;

/**
 * Lifecycle of one assistant run. CLOSED is reachable from every state.
 */
public enum RunState {
    AWAITING_MODEL,
    STREAMING,
    TOOL_EXEC,
    FINALIZING,
    CLOSED
}
