package com.liferx.brain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One entry of the conversation sent to the model. The list is append-only
 * within a request and never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;

    /** May be null on an assistant message that only carries tool calls */
    private String content;

    /** Present when role = tool: links back to the assistant's tool call id */
    private String toolCallId;

    /** Present when role = tool: the name of the tool that produced this result */
    private String name;

    /**
     * Present when role = assistant and the model requested tool calls.
     * Echoed back on the next model call so results can be correlated.
     */
    private List<ToolCallRef> toolCalls;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message toolResult(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(Role.tool)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(content)
                .build();
    }
}
