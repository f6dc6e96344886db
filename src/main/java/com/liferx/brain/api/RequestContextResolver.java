package com.liferx.brain.api;

import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.exception.InvalidRequestException;
import com.liferx.brain.model.AssistantRunRequest;
import com.liferx.brain.tool.ToolContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Turns the optional request "context" block into a ToolContext,
 * applying agent.default-org-id when the caller sent no org_id.
 */
@Component
@RequiredArgsConstructor
public class RequestContextResolver {

    private final AgentProperties properties;

    /**
     * @param generateSessionId give the request a random session id when it has none
     * @throws InvalidRequestException when no org id can be determined
     */
    public ToolContext resolve(AssistantRunRequest.RequestContext context, boolean generateSessionId) {
        AssistantRunRequest.RequestContext ctx =
                context != null ? context : new AssistantRunRequest.RequestContext();

        String orgId = isBlank(ctx.getOrgId()) ? properties.getDefaultOrgId() : ctx.getOrgId();
        if (isBlank(orgId)) {
            throw new InvalidRequestException("org_id is required (either in context or via agent.default-org-id)");
        }

        String sessionId = ctx.getSessionId();
        if (isBlank(sessionId) && generateSessionId) {
            sessionId = UUID.randomUUID().toString();
        }

        return ToolContext.builder()
                .orgId(orgId)
                .sessionId(sessionId)
                .userId(ctx.getUserId())
                .allowWrites(ctx.isAllowWrites())
                .metadata(ctx.getMetadata() != null ? ctx.getMetadata() : Map.of())
                .build();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
