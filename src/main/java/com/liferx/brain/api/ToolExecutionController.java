package com.liferx.brain.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.exception.InvalidRequestException;
import com.liferx.brain.model.ToolExecuteRequest;
import com.liferx.brain.model.ToolExecuteResponse;
import com.liferx.brain.resilience.IdempotencyService;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolErrorCode;
import com.liferx.brain.tool.ToolExecutionResult;
import com.liferx.brain.tool.ToolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Server-to-server tool invocation, outside any conversation.
 *
 * POST /api/tools/execute
 *   Required header: X-Internal-Secret
 *   Optional header: Idempotency-Key: successful results are replayed for 24h
 *
 * | Result              | Status |
 * |---------------------|--------|
 * | ok                  | 200    |
 * | TOOL_NOT_FOUND      | 404    |
 * | WRITE_NOT_ALLOWED   | 403    |
 * | VALIDATION_ERROR    | 400    |
 * | EXECUTION_ERROR     | 500    |
 */
@RestController
@RequestMapping("/api/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolExecutionController {

    private final ToolExecutor toolExecutor;
    private final InternalSecretVerifier secretVerifier;
    private final RequestContextResolver contextResolver;
    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @PostMapping("/execute")
    public ResponseEntity<ToolExecuteResponse> execute(
            @RequestHeader(value = InternalSecretVerifier.HEADER, required = false) String secret,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @RequestBody ToolExecuteRequest request) {

        secretVerifier.verify(secret);
        if (request.getToolName() == null || request.getToolName().isBlank()) {
            throw new InvalidRequestException("toolName is required and must be a string");
        }
        ToolContext context = contextResolver.resolve(request.getContext(), false);

        log.info("Tool execute request [tool={}, org={}, idempotencyKey={}]",
                request.getToolName(), context.getOrgId(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<ToolExecuteResponse> cached = cachedResponse(idempotencyKey);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            idempotencyService.claimKey(idempotencyKey);
        }

        ToolExecutionResult result = toolExecutor.execute(request.getToolName(), request.getArgs(), context);
        ToolExecuteResponse response = ToolExecuteResponse.from(result);

        if (idempotent) {
            if (result.isOk()) {
                try {
                    idempotencyService.storeResponse(idempotencyKey, objectMapper.writeValueAsString(response));
                } catch (Exception e) {
                    log.warn("Failed to cache idempotency response", e);
                }
            } else {
                idempotencyService.releaseKey(idempotencyKey);
            }
        }

        return ResponseEntity.status(statusFor(result)).body(response);
    }

    private Optional<ToolExecuteResponse> cachedResponse(String idempotencyKey) {
        Optional<String> cached = idempotencyService.getCachedResponse(idempotencyKey);
        if (cached.isEmpty()) return Optional.empty();
        try {
            log.info("Returning cached response for idempotency key={}", idempotencyKey);
            return Optional.of(objectMapper.readValue(cached.get(), ToolExecuteResponse.class));
        } catch (Exception e) {
            log.warn("Failed to deserialize cached response, proceeding fresh", e);
            return Optional.empty();
        }
    }

    static HttpStatus statusFor(ToolExecutionResult result) {
        if (result.isOk()) return HttpStatus.OK;
        ToolErrorCode code = ((ToolExecutionResult.Failure) result).code();
        return switch (code) {
            case TOOL_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case WRITE_NOT_ALLOWED -> HttpStatus.FORBIDDEN;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case EXECUTION_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
