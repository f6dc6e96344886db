package com.liferx.brain.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One tool invocation, written as "started" before the tool runs and
 * updated exactly once to "success" or "error" afterwards.
 *
 * Collection: ai_tool_logs
 *
 * args, result and explainability are stored after sanitization, so
 * secrets never land in this collection.
 */
@Document(collection = "ai_tool_logs")
@CompoundIndexes({
    @CompoundIndex(name = "idx_org_started",      def = "{'orgId': 1, 'startedAt': -1}"),
    @CompoundIndex(name = "idx_org_tool_started", def = "{'orgId': 1, 'toolName': 1, 'startedAt': -1}"),
    @CompoundIndex(name = "idx_session_started",  def = "{'sessionId': 1, 'startedAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolAuditLog {

    public enum Status { started, success, error }

    @Id
    private String id;

    private String orgId;
    private String sessionId;
    private String userId;
    private String toolName;

    private Status status;

    private Object args;
    private Object result;
    private Object explainability;

    /** Set only when status = error */
    private String errorCode;
    private String error;

    private Map<String, Object> metadata;

    private Instant startedAt;
    private Instant finishedAt;
    private Long durationMs;
}
