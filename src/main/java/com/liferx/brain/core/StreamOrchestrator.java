package com.liferx.brain.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.event.DeltaEvent;
import com.liferx.brain.event.EventStreamWriter;
import com.liferx.brain.event.FinalEvent;
import com.liferx.brain.event.ToolResultEvent;
import com.liferx.brain.event.ToolStartEvent;
import com.liferx.brain.llm.ModelBackend;
import com.liferx.brain.model.Message;
import com.liferx.brain.model.ModelChunk;
import com.liferx.brain.model.ToolCallRef;
import com.liferx.brain.sanitize.ResultSanitizer;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolExecutionResult;
import com.liferx.brain.tool.ToolExecutor;
import com.liferx.brain.tool.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Streaming tool-calling loop.
 *
 * <pre>
 * AWAITING_MODEL → STREAMING → (TOOL_EXEC ⇄ AWAITING_MODEL) → FINALIZING → CLOSED
 * </pre>
 *
 * Each iteration streams one model turn, forwarding content as delta events
 * and buffering tool-call fragments. Buffered calls are executed one at a time
 * through the {@link ToolExecutor}; every issued call gets exactly one tool
 * message back, even past the budget. A run ends with exactly one final event
 * unless the client went away, in which case the stream is closed without one.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StreamOrchestrator {

    static final String BUDGET_NOTE = "\n\n*Note: Maximum tool calls reached for this request.*";
    static final String ITERATION_NOTE = "\n\n*Note: Maximum reasoning steps reached for this request.*";
    static final String INTERRUPTED_NOTE = "\n\n[Stream interrupted]";
    static final String APOLOGY =
            "Sorry, something went wrong while generating a response. Please try again in a moment.";
    static final String BUDGET_EXHAUSTED_ERROR = "Tool call budget exhausted for this request";

    private static final String SYSTEM_PROMPT = """
            You are %s, an intelligent assistant that helps users manage their organisation's knowledge base.

            ## Operating Rules

            1. Prefer tools when they increase correctness
               - Use brain.search_items BEFORE claiming something is already stored
               - Use brain.search_items to find relevant context before answering knowledge questions

            2. Only persist when explicitly requested
               - Use brain.upsert_item ONLY when the user explicitly asks to save, store, remember or create an item
               - Never save without user intent

            3. Tool usage
               - When searching, be specific with your query terms
               - When saving, choose the appropriate type (decision, sop, principle, playbook)
               - Provide clear, descriptive titles and comprehensive content

            4. Response format
               - Be concise and helpful
               - If tool results are empty, say so clearly

            You have access to a persistent knowledge base. Use it to give accurate, grounded answers.
            """;

    private final ModelBackend modelBackend;
    private final ToolRegistry toolRegistry;
    private final ToolExecutor toolExecutor;
    private final ResultSanitizer sanitizer;
    private final NextActionSuggester nextActionSuggester;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Drive one run to completion on the calling thread.
     *
     * @param conversation client messages (user/assistant only), oldest first
     * @param toolContext  permissions and identity for every tool call in this run
     * @param writer       destination for stream events; closed when this method returns
     * @param cancellation tripped when the client disconnects
     */
    public void run(List<Message> conversation,
                    ToolContext toolContext,
                    EventStreamWriter writer,
                    CancellationToken cancellation) {

        AgentContext ctx = AgentContext.builder()
                .sessionId(toolContext.getSessionId())
                .toolContext(toolContext)
                .build();
        ctx.addMessage(Message.system(SYSTEM_PROMPT.formatted(properties.getName())));
        conversation.forEach(ctx::addMessage);

        log.info("Assistant run started [session={}, org={}, allowWrites={}]",
                ctx.getSessionId(), toolContext.getOrgId(), toolContext.isAllowWrites());

        try {
            loop(ctx, writer, cancellation);
            if (cancellation.isCancelled()) {
                log.info("Run aborted by client [session={}]", ctx.getSessionId());
                return;
            }
            finishSuccess(ctx, writer);
        } catch (RuntimeException e) {
            if (cancellation.isCancelled()) {
                log.info("Run aborted by client [session={}]: {}", ctx.getSessionId(), e.getMessage());
                return;
            }
            log.error("Assistant run failed [session={}]: {}", ctx.getSessionId(), e.getMessage(), e);
            finishError(ctx, writer);
        } finally {
            ctx.setState(RunState.CLOSED);
            writer.close();
            log.info("Assistant run closed [session={}, iterations={}, toolCalls={}]",
                    ctx.getSessionId(), ctx.getIterations(), ctx.getToolCallCount());
        }
    }

    private void loop(AgentContext ctx, EventStreamWriter writer, CancellationToken cancellation) {
        int maxIterations = properties.getMaxIterations();
        int maxToolCalls = properties.getMaxToolCalls();

        while (true) {
            if (cancellation.isCancelled()) return;

            ctx.setIterations(ctx.getIterations() + 1);
            ctx.setState(RunState.AWAITING_MODEL);
            log.info("Agent iteration {}/{} [session={}]", ctx.getIterations(), maxIterations, ctx.getSessionId());

            Turn turn = streamTurn(ctx, writer, cancellation);
            if (turn == null) return;

            List<ToolCallRef> valid = turn.calls().stream().filter(ToolCallRef::isValid).toList();
            if (valid.size() < turn.calls().size()) {
                log.warn("Discarded {} incomplete tool call(s) [session={}]",
                        turn.calls().size() - valid.size(), ctx.getSessionId());
            }
            if (ModelChunk.FINISH_STOP.equals(turn.finishReason())) {
                ctx.setStopRequested(true);
            }
            if (valid.isEmpty()) {
                return;
            }

            ctx.addMessage(Message.builder()
                    .role(Message.Role.assistant)
                    .content(turn.content().isEmpty() ? null : turn.content())
                    .toolCalls(valid)
                    .build());

            ctx.setState(RunState.TOOL_EXEC);
            if (!executeBatch(ctx, valid, writer, cancellation)) return;

            if (ctx.isStopRequested()) return;
            if (ctx.getToolCallCount() >= maxToolCalls) {
                ctx.setBudgetExhausted(true);
                log.warn("Tool call budget of {} reached [session={}]", maxToolCalls, ctx.getSessionId());
                return;
            }
            if (ctx.getIterations() >= maxIterations) {
                ctx.setIterationsExhausted(true);
                log.warn("Max iterations ({}) reached [session={}]", maxIterations, ctx.getSessionId());
                return;
            }
        }
    }

    /**
     * Stream one model turn. Returns null if the run was cancelled mid-stream.
     */
    private Turn streamTurn(AgentContext ctx, EventStreamWriter writer, CancellationToken cancellation) {
        ToolCallAccumulator accumulator = new ToolCallAccumulator();
        StringBuilder turnContent = new StringBuilder();
        String finishReason = null;

        try (Stream<ModelChunk> chunks = modelBackend.streamChat(ctx.getMessages(), toolRegistry.schemas())) {
            ctx.setState(RunState.STREAMING);
            Iterator<ModelChunk> it = chunks.iterator();
            while (it.hasNext()) {
                if (cancellation.isCancelled()) return null;
                ModelChunk chunk = it.next();

                if (chunk.hasContent()) {
                    turnContent.append(chunk.content());
                    ctx.getFullContent().append(chunk.content());
                    writer.emit(new DeltaEvent(chunk.content()));
                }
                chunk.toolCalls().forEach(accumulator::accept);

                if (chunk.finishReason() != null) {
                    finishReason = chunk.finishReason();
                    if (ModelChunk.FINISH_STOP.equals(finishReason)
                            || ModelChunk.FINISH_TOOL_CALLS.equals(finishReason)) {
                        break;
                    }
                }
            }
        }
        if (cancellation.isCancelled()) return null;

        log.debug("Model turn ended [finish={}, session={}]", finishReason, ctx.getSessionId());
        return new Turn(turnContent.toString(), accumulator.drain(), finishReason);
    }

    /**
     * Execute a batch sequentially. Returns false if the run was cancelled.
     */
    private boolean executeBatch(AgentContext ctx,
                                 List<ToolCallRef> calls,
                                 EventStreamWriter writer,
                                 CancellationToken cancellation) {
        for (ToolCallRef call : calls) {
            if (cancellation.isCancelled()) return false;

            ctx.setToolCallCount(ctx.getToolCallCount() + 1);
            if (ctx.getToolCallCount() > properties.getMaxToolCalls()) {
                log.info("Skipping tool [{}]: budget exhausted [session={}]", call.name(), ctx.getSessionId());
                ctx.addMessage(Message.toolResult(call.id(), call.name(), errorJson(BUDGET_EXHAUSTED_ERROR)));
                continue;
            }

            writer.emit(new ToolStartEvent(call.name()));
            ToolExecutionResult result = toolExecutor.execute(call.name(), call.rawArguments(), ctx.getToolContext());

            JsonNode clientData;
            JsonNode explainability;
            String modelContent;
            if (result instanceof ToolExecutionResult.Success success) {
                clientData = sanitizer.sanitize(success.response().getData());
                explainability = sanitizer.sanitize(success.response().getExplainability());
                modelContent = toJson(success.response().getData(), clientData);
            } else {
                ToolExecutionResult.Failure failure = (ToolExecutionResult.Failure) result;
                clientData = objectMapper.createObjectNode().put("error", failure.message());
                explainability = objectMapper.createObjectNode().put("error_code", failure.code().name());
                modelContent = errorJson(failure.message());
            }

            writer.emit(new ToolResultEvent(call.name(), clientData, explainability, !result.isOk()));
            ctx.addMessage(Message.toolResult(call.id(), call.name(), modelContent));
        }
        return !cancellation.isCancelled();
    }

    private void finishSuccess(AgentContext ctx, EventStreamWriter writer) {
        StringBuilder content = ctx.getFullContent();
        if (ctx.isBudgetExhausted()) {
            content.append(BUDGET_NOTE);
        } else if (ctx.isIterationsExhausted()) {
            content.append(ITERATION_NOTE);
        }
        String text = content.toString();
        sendFinal(ctx, writer, text, nextActionSuggester.suggest(text, ctx.getMessages()));
    }

    private void finishError(AgentContext ctx, EventStreamWriter writer) {
        String partial = ctx.getFullContent().toString();
        String text = partial.isEmpty() ? APOLOGY : partial + INTERRUPTED_NOTE;
        sendFinal(ctx, writer, text, NextActionSuggester.RETRY_ACTIONS);
    }

    private void sendFinal(AgentContext ctx, EventStreamWriter writer, String content, List<String> nextActions) {
        if (ctx.getState() == RunState.FINALIZING || writer.isFinalSent()) return;
        ctx.setState(RunState.FINALIZING);
        writer.emit(new FinalEvent(new FinalEvent.FinalPayload(properties.getName(), content, nextActions)));
    }

    // The model gets the unsanitized data; fall back to the sanitized tree if it won't serialize
    private String toJson(Object data, JsonNode fallback) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.warn("Tool data not serializable, sending sanitized copy: {}", e.getOriginalMessage());
            return fallback.toString();
        }
    }

    private String errorJson(String message) {
        ObjectNode node = objectMapper.createObjectNode().put("error", message);
        return node.toString();
    }

    private record Turn(String content, List<ToolCallRef> calls, String finishReason) {
    }
}
