package com.liferx.brain.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.liferx.brain.audit.AuditHandle;
import com.liferx.brain.audit.ToolAuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Single entry point for running a tool, shared by the streaming loop and
 * the synchronous /api/tools/execute endpoint.
 *
 * Pipeline: lookup → write gate → parse/validate → audit start → run → audit end.
 * Never throws: every failure is returned as a {@link ToolExecutionResult.Failure}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ToolExecutor {

    static final String INVALID_JSON_MESSAGE = "Invalid tool arguments JSON";

    private final ToolRegistry registry;
    private final ToolAuditService auditService;
    private final ObjectMapper objectMapper;

    /**
     * Execute with arguments already parsed as JSON.
     */
    public ToolExecutionResult execute(String toolName, JsonNode args, ToolContext context) {
        Optional<ToolDefinition<?>> tool = registry.lookup(toolName);
        if (tool.isEmpty()) {
            return notFound(toolName);
        }
        if (!writeAllowed(tool.get(), context)) {
            return writeDenied(toolName, context);
        }
        return validateAndRun(tool.get(), args == null ? NullNode.getInstance() : args, context);
    }

    /**
     * Execute with the raw argument text accumulated from a model stream.
     * A blank string means "no arguments"; anything that isn't JSON is a VALIDATION_ERROR.
     */
    public ToolExecutionResult execute(String toolName, String rawArguments, ToolContext context) {
        Optional<ToolDefinition<?>> tool = registry.lookup(toolName);
        if (tool.isEmpty()) {
            return notFound(toolName);
        }
        if (!writeAllowed(tool.get(), context)) {
            return writeDenied(toolName, context);
        }

        JsonNode args;
        try {
            args = rawArguments == null || rawArguments.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(rawArguments);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable arguments for tool [{}] [session={}]", toolName, context.getSessionId());
            return ToolExecutionResult.failure(toolName, ToolErrorCode.VALIDATION_ERROR,
                    INVALID_JSON_MESSAGE, rawArguments);
        }
        return validateAndRun(tool.get(), args, context);
    }

    private <A> ToolExecutionResult validateAndRun(ToolDefinition<A> tool, JsonNode args, ToolContext context) {
        String name = tool.getName();

        A validated;
        try {
            validated = tool.validateArgs(args);
        } catch (ToolValidationException e) {
            log.info("Validation failed for tool [{}]: {}", name, e.getMessage());
            return ToolExecutionResult.failure(name, ToolErrorCode.VALIDATION_ERROR, e.getMessage(), args);
        } catch (RuntimeException e) {
            log.warn("Validator for tool [{}] threw unexpectedly: {}", name, e.toString());
            return ToolExecutionResult.failure(name, ToolErrorCode.VALIDATION_ERROR, messageOf(e), args);
        }

        log.debug("Executing tool [{}] [session={}] with args: {}", name, context.getSessionId(), args);
        AuditHandle handle = auditService.logStart(name, args, context);

        try {
            ToolResponse response = tool.run(validated, context);
            if (response == null) {
                response = ToolResponse.of(null);
            }
            auditService.logSuccess(handle, response);
            log.info("Tool [{}] succeeded in {}ms [session={}]",
                    name, System.currentTimeMillis() - handle.startedAtMs(), context.getSessionId());
            return ToolExecutionResult.success(name, response);
        } catch (Exception e) {
            log.error("Tool [{}] failed [session={}]: {}", name, context.getSessionId(), e.getMessage(), e);
            String message = messageOf(e);
            auditService.logError(handle, ToolErrorCode.EXECUTION_ERROR, message);
            return ToolExecutionResult.failure(name, ToolErrorCode.EXECUTION_ERROR, message);
        }
    }

    private static boolean writeAllowed(ToolDefinition<?> tool, ToolContext context) {
        return !tool.isWrites() || context.isAllowWrites();
    }

    private static ToolExecutionResult notFound(String toolName) {
        log.warn("Unknown tool requested: [{}]", toolName);
        return ToolExecutionResult.failure(toolName, ToolErrorCode.TOOL_NOT_FOUND,
                "Tool not found: " + toolName);
    }

    private static ToolExecutionResult writeDenied(String toolName, ToolContext context) {
        log.warn("Write tool [{}] denied [session={}]", toolName, context.getSessionId());
        return ToolExecutionResult.failure(toolName, ToolErrorCode.WRITE_NOT_ALLOWED,
                "Tool '" + toolName + "' performs writes, which are not allowed for this request");
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
