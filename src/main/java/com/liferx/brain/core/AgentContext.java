package com.liferx.brain.core;

import com.liferx.brain.model.Message;
import com.liferx.brain.tool.ToolContext;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of a single assistant run, owned by one worker thread.
 */
@Data
@Builder
public class AgentContext {

    private final String sessionId;
    private final ToolContext toolContext;

    /** Full conversation sent to the model: system + client messages + assistant/tool turns */
    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /** All content streamed to the client so far, across iterations */
    @Builder.Default
    private StringBuilder fullContent = new StringBuilder();

    @Builder.Default
    private RunState state = RunState.AWAITING_MODEL;

    private int iterations;
    private int toolCallCount;

    /** Set when the model ended a turn with finish_reason=stop */
    private boolean stopRequested;

    private boolean budgetExhausted;
    private boolean iterationsExhausted;

    public void addMessage(Message message) {
        messages.add(message);
    }
}
