package com.liferx.brain.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.exception.AgentException;
import com.liferx.brain.model.Message;
import com.liferx.brain.model.ModelChunk;
import com.liferx.brain.model.ToolCallFragment;
import com.liferx.brain.model.ToolCallRef;
import com.liferx.brain.tool.ToolSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Streaming client for OpenAI-compatible /chat/completions.
 *
 * The response is consumed line by line: every "data: {...}" line becomes one
 * {@link ModelChunk}, "data: [DONE]" ends the stream. Lines that are not JSON
 * are logged and skipped rather than failing the whole response.
 *
 * Error handling:
 * | Condition        | Result                                          |
 * |------------------|-------------------------------------------------|
 * | non-2xx on open  | AgentException (counts as circuit-breaker failure) |
 * | connect timeout  | ResourceAccessException                         |
 * | read failure     | UncheckedIOException while iterating            |
 */
@Slf4j
public class OpenAiStreamingClient implements ModelBackend {

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String SSE_DONE = "data: [DONE]";

    private final LlmProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public OpenAiStreamingClient(LlmProperties props,
                                 ObjectMapper objectMapper,
                                 RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public Stream<ModelChunk> streamChat(List<Message> messages, List<ToolSchema> tools) {
        Map<String, Object> body = buildRequestBody(messages, tools);
        log.debug("Streaming {} messages to model [{}]", messages.size(), props.getModel());

        return restClient.post()
                .uri("/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .body(body)
                .exchange((request, response) -> {
                    HttpStatusCode status = response.getStatusCode();
                    if (status.isError()) {
                        String error;
                        try (response) {
                            error = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        }
                        log.error("Model backend returned {}: {}", status, error);
                        throw new AgentException("Model backend error [" + status.value() + "]");
                    }
                    BufferedReader reader = new BufferedReader(
                            new InputStreamReader(response.getBody(), StandardCharsets.UTF_8));
                    return reader.lines()
                            .map(String::trim)
                            .takeWhile(line -> !SSE_DONE.equals(line))
                            .map(this::parseLine)
                            .flatMap(Optional::stream)
                            .onClose(response::close);
                }, false);
    }

    /**
     * Parse one SSE line into a chunk. Blank lines, comments and event fields
     * yield empty, as do payloads without choices.
     */
    Optional<ModelChunk> parseLine(String line) {
        if (line == null || !line.startsWith(SSE_DATA_PREFIX)) {
            return Optional.empty();
        }
        String payload = line.substring(SSE_DATA_PREFIX.length()).trim();
        if (payload.isEmpty() || "[DONE]".equals(payload)) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping unparseable stream line: {}", e.getOriginalMessage());
            return Optional.empty();
        }

        JsonNode choice = root.path("choices").path(0);
        if (choice.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode delta = choice.path("delta");

        String content = delta.path("content").isTextual() ? delta.path("content").asText() : null;

        List<ToolCallFragment> fragments = new ArrayList<>();
        JsonNode toolCalls = delta.path("tool_calls");
        if (toolCalls.isArray()) {
            for (int i = 0; i < toolCalls.size(); i++) {
                JsonNode tc = toolCalls.get(i);
                JsonNode fn = tc.path("function");
                fragments.add(new ToolCallFragment(
                        tc.path("index").asInt(i),
                        textOrNull(tc.path("id")),
                        textOrNull(fn.path("name")),
                        textOrNull(fn.path("arguments"))));
            }
        }

        String finishReason = textOrNull(choice.path("finish_reason"));
        return Optional.of(new ModelChunk(content, fragments, finishReason));
    }

    private Map<String, Object> buildRequestBody(List<Message> messages, List<ToolSchema> tools) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", props.getModel());
        body.put("max_tokens", props.getMaxTokens());
        body.put("temperature", props.getTemperature());
        body.put("stream", true);
        body.put("messages", messages.stream().map(this::formatMessage).toList());

        if (!tools.isEmpty()) {
            body.put("tools", tools.stream().map(ToolSchema::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new HashMap<>();
        m.put("role", msg.getRole().name());

        if (msg.getRole() == Message.Role.tool) {
            m.put("tool_call_id", msg.getToolCallId());
            m.put("content", msg.getContent());
        } else if (msg.getRole() == Message.Role.assistant) {
            m.put("content", msg.getContent());
            if (msg.getToolCalls() != null && !msg.getToolCalls().isEmpty()) {
                m.put("tool_calls", msg.getToolCalls().stream().map(this::formatToolCall).toList());
            }
        } else {
            m.put("content", msg.getContent() != null ? msg.getContent() : "");
        }
        return m;
    }

    private Map<String, Object> formatToolCall(ToolCallRef ref) {
        String args = ref.rawArguments() == null || ref.rawArguments().isBlank() ? "{}" : ref.rawArguments();
        return Map.of(
                "id", ref.id(),
                "type", "function",
                "function", Map.of("name", ref.name(), "arguments", args)
        );
    }

    private static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }
}
