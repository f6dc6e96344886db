package com.liferx.brain.llm;

import com.liferx.brain.model.Message;
import com.liferx.brain.model.ModelChunk;
import com.liferx.brain.tool.ToolSchema;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Stream;

/**
 * Circuit-breaker decorator around the streaming client.
 *
 * No retry: a partially streamed answer cannot be replayed safely, so a
 * failed call surfaces to the orchestrator as an error final. While the
 * breaker is open calls fail immediately with CallNotPermittedException.
 *
 * Only opening the stream is guarded; failures while iterating are handled
 * by the caller.
 */
@Component
@Primary
public class ResilientModelBackend implements ModelBackend {

    private final ModelBackend delegate;

    public ResilientModelBackend(@Qualifier("openAiStreamingClient") ModelBackend delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "modelBackend")
    public Stream<ModelChunk> streamChat(List<Message> messages, List<ToolSchema> tools) {
        return delegate.streamChat(messages, tools);
    }
}
