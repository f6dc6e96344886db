package com.liferx.brain.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.core.CancellationToken;
import com.liferx.brain.core.StreamOrchestrator;
import com.liferx.brain.event.EventProtocolEncoder;
import com.liferx.brain.event.EventStreamWriter;
import com.liferx.brain.event.SseEmitterSink;
import com.liferx.brain.exception.AgentException;
import com.liferx.brain.model.AssistantRunRequest;
import com.liferx.brain.model.Message;
import com.liferx.brain.tool.ToolContext;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * Streaming assistant endpoint.
 *
 * POST /api/assistant/run  → text/event-stream
 *
 * Request validation happens here, before the stream opens, so bad input
 * gets a plain 400. Once the emitter is returned every outcome, errors
 * included, is reported inside the stream.
 */
@RestController
@RequestMapping("/api/assistant")
@Slf4j
public class AssistantController {

    private final StreamOrchestrator orchestrator;
    private final RequestContextResolver contextResolver;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor streamTaskExecutor;

    public AssistantController(StreamOrchestrator orchestrator,
                               RequestContextResolver contextResolver,
                               AgentProperties properties,
                               ObjectMapper objectMapper,
                               @Qualifier("streamTaskExecutor") Executor streamTaskExecutor) {
        this.orchestrator = orchestrator;
        this.contextResolver = contextResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.streamTaskExecutor = streamTaskExecutor;
    }

    @PostMapping(value = "/run", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter run(@Valid @RequestBody AssistantRunRequest request) {
        ToolContext toolContext = contextResolver.resolve(request.getContext(), true);
        List<Message> conversation = request.getMessages().stream()
                .map(m -> Message.builder()
                        .role(Message.Role.valueOf(m.getRole()))
                        .content(m.getContent())
                        .build())
                .toList();

        log.info("Assistant run request [session={}, org={}, messages={}]",
                toolContext.getSessionId(), toolContext.getOrgId(), conversation.size());

        SseEmitter emitter = new SseEmitter(properties.getStreamTimeoutMs());
        CancellationToken cancellation = new CancellationToken();
        emitter.onCompletion(cancellation::cancel);
        emitter.onTimeout(cancellation::cancel);
        emitter.onError(e -> cancellation.cancel());

        EventStreamWriter writer = new EventStreamWriter(
                new EventProtocolEncoder(objectMapper), new SseEmitterSink(emitter), cancellation);

        try {
            streamTaskExecutor.execute(() -> orchestrator.run(conversation, toolContext, writer, cancellation));
        } catch (TaskRejectedException e) {
            throw new AgentException("Assistant is at capacity, please retry shortly", e);
        }
        return emitter;
    }
}
