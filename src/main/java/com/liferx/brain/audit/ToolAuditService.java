package com.liferx.brain.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.sanitize.ResultSanitizer;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolErrorCode;
import com.liferx.brain.tool.ToolResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Writes the tool audit trail to MongoDB.
 *
 * Audit is best-effort: a Mongo outage must never fail a tool call, so every
 * write here catches and logs. When the "started" insert fails the caller gets
 * a placeholder handle and the terminal update is skipped.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ToolAuditService {

    private final MongoTemplate mongoTemplate;
    private final ToolAuditLogRepository repository;
    private final ResultSanitizer sanitizer;
    private final ObjectMapper objectMapper;

    public AuditHandle logStart(String toolName, JsonNode args, ToolContext context) {
        long now = System.currentTimeMillis();
        try {
            ToolAuditLog entry = ToolAuditLog.builder()
                    .orgId(context.getOrgId())
                    .sessionId(context.getSessionId())
                    .userId(context.getUserId())
                    .toolName(toolName)
                    .status(ToolAuditLog.Status.started)
                    .args(toStorable(sanitizer.sanitize(args)))
                    .metadata(context.getMetadata())
                    .startedAt(Instant.ofEpochMilli(now))
                    .build();
            ToolAuditLog saved = mongoTemplate.insert(entry);
            return AuditHandle.of(saved.getId(), now);
        } catch (Exception e) {
            log.error("Failed to write audit start for tool [{}] [session={}]: {}",
                    toolName, context.getSessionId(), e.getMessage());
            return AuditHandle.failed(now);
        }
    }

    public void logSuccess(AuditHandle handle, ToolResponse response) {
        if (handle.placeholder()) return;
        try {
            long now = System.currentTimeMillis();
            Update update = new Update()
                    .set("status", ToolAuditLog.Status.success)
                    .set("result", toStorable(sanitizer.sanitize(response.getData())))
                    .set("explainability", toStorable(sanitizer.sanitize(response.getExplainability())))
                    .set("finishedAt", Instant.ofEpochMilli(now))
                    .set("durationMs", now - handle.startedAtMs());
            finish(handle, update);
        } catch (Exception e) {
            log.error("Failed to record audit success [{}]: {}", handle.id(), e.getMessage());
        }
    }

    public void logError(AuditHandle handle, ToolErrorCode code, String message) {
        if (handle.placeholder()) return;
        try {
            long now = System.currentTimeMillis();
            Update update = new Update()
                    .set("status", ToolAuditLog.Status.error)
                    .set("errorCode", code.name())
                    .set("error", message)
                    .set("finishedAt", Instant.ofEpochMilli(now))
                    .set("durationMs", now - handle.startedAtMs());
            finish(handle, update);
        } catch (Exception e) {
            log.error("Failed to record audit error [{}]: {}", handle.id(), e.getMessage());
        }
    }

    public List<ToolAuditLog> findBySession(String sessionId) {
        return repository.findBySessionIdOrderByStartedAtDesc(sessionId);
    }

    public List<ToolAuditLog> findByOrg(String orgId, String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return repository.findByOrgIdOrderByStartedAtDesc(orgId);
        }
        return repository.findByOrgIdAndToolNameOrderByStartedAtDesc(orgId, toolName);
    }

    private void finish(AuditHandle handle, Update update) {
        try {
            Query query = new Query(Criteria.where("_id").is(handle.id()));
            mongoTemplate.updateFirst(query, update, ToolAuditLog.class);
        } catch (Exception e) {
            log.error("Failed to finalize audit entry [{}]: {}", handle.id(), e.getMessage());
        }
    }

    // Mongo's converters don't know JsonNode; store plain maps/lists instead
    private Object toStorable(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return objectMapper.convertValue(node, Object.class);
    }
}
