package com.liferx.brain.model;

import java.util.List;

/**
 * One parsed chunk of a streaming model response.
 *
 * @param content      text delta, null when absent
 * @param toolCalls    tool-call fragments, never null
 * @param finishReason "stop", "tool_calls", "length", ... or null while streaming
 */
public record ModelChunk(String content, List<ToolCallFragment> toolCalls, String finishReason) {

    public static final String FINISH_STOP = "stop";
    public static final String FINISH_TOOL_CALLS = "tool_calls";

    public ModelChunk {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelChunk content(String text) {
        return new ModelChunk(text, List.of(), null);
    }

    public static ModelChunk toolCall(ToolCallFragment fragment) {
        return new ModelChunk(null, List.of(fragment), null);
    }

    public static ModelChunk finish(String reason) {
        return new ModelChunk(null, List.of(), reason);
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
