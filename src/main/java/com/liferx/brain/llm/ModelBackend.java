package com.liferx.brain.llm;

import com.liferx.brain.model.Message;
import com.liferx.brain.model.ModelChunk;
import com.liferx.brain.tool.ToolSchema;

import java.util.List;
import java.util.stream.Stream;

public interface ModelBackend {

    /**
     * Start a streaming completion over the full conversation.
     *
     * The returned stream is lazy and holds the HTTP connection open; callers
     * must close it (try-with-resources). Read failures surface as unchecked
     * exceptions while iterating.
     *
     * @param messages full conversation so far (system + user + assistant + tool results)
     * @param tools    schemas of the tools the model may call
     */
    Stream<ModelChunk> streamChat(List<Message> messages, List<ToolSchema> tools);
}
