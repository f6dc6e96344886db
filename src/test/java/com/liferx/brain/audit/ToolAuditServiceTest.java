package com.liferx.brain.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.sanitize.ResultSanitizer;
import com.liferx.brain.tool.SelfReferencingData;
import com.liferx.brain.tool.ToolContext;
import com.liferx.brain.tool.ToolErrorCode;
import com.liferx.brain.tool.ToolResponse;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolAuditServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MongoTemplate mongoTemplate;
    private ToolAuditLogRepository repository;
    private ToolAuditService service;

    private final ToolContext context = ToolContext.builder()
            .orgId("org-1").sessionId("session-1").userId("user-1").build();

    @BeforeEach
    void setUp() {
        mongoTemplate = mock(MongoTemplate.class);
        repository = mock(ToolAuditLogRepository.class);
        ResultSanitizer sanitizer = new ResultSanitizer(new AgentProperties.Sanitizer(), objectMapper);
        service = new ToolAuditService(mongoTemplate, repository, sanitizer, objectMapper);
    }

    @Test
    void logStart_insertsStartedEntryWithSanitizedArgs() {
        when(mongoTemplate.insert(any(ToolAuditLog.class))).thenAnswer(inv -> {
            ToolAuditLog log = inv.getArgument(0);
            log.setId("log-42");
            return log;
        });

        AuditHandle handle = service.logStart("brain.search_items",
                objectMapper.createObjectNode().put("query", "pricing").put("api_key", "sk-1"), context);

        assertThat(handle.id()).isEqualTo("log-42");
        assertThat(handle.placeholder()).isFalse();

        ArgumentCaptor<ToolAuditLog> captor = ArgumentCaptor.forClass(ToolAuditLog.class);
        verify(mongoTemplate).insert(captor.capture());
        ToolAuditLog entry = captor.getValue();
        assertThat(entry.getStatus()).isEqualTo(ToolAuditLog.Status.started);
        assertThat(entry.getOrgId()).isEqualTo("org-1");
        assertThat(entry.getSessionId()).isEqualTo("session-1");
        assertThat(entry.getToolName()).isEqualTo("brain.search_items");
        assertThat(entry.getArgs()).isEqualTo(Map.of("query", "pricing", "api_key", ResultSanitizer.REDACTED));
        assertThat(entry.getStartedAt()).isNotNull();
    }

    @Test
    void logStart_mongoDown_returnsPlaceholder() {
        when(mongoTemplate.insert(any(ToolAuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        AuditHandle handle = service.logStart("brain.search_items", objectMapper.createObjectNode(), context);

        assertThat(handle.placeholder()).isTrue();
        assertThat(handle.id()).isEqualTo(AuditHandle.FAILED_ID);
    }

    @Test
    void logSuccess_placeholderHandle_skipsUpdate() {
        service.logSuccess(AuditHandle.failed(0L), ToolResponse.of(Map.of("items", List.of())));

        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(ToolAuditLog.class));
    }

    @Test
    void logError_placeholderHandle_skipsUpdate() {
        service.logError(AuditHandle.failed(0L), ToolErrorCode.EXECUTION_ERROR, "boom");

        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(ToolAuditLog.class));
    }

    @Test
    void logSuccess_updatesEntryToSuccess() {
        service.logSuccess(AuditHandle.of("log-1", System.currentTimeMillis()),
                ToolResponse.of(Map.of("items", List.of()), Map.of("results_count", 0)));

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), captor.capture(), eq(ToolAuditLog.class));
        Document set = (Document) captor.getValue().getUpdateObject().get("$set");
        assertThat(set.get("status")).isEqualTo(ToolAuditLog.Status.success);
        assertThat(set).containsKeys("result", "explainability", "finishedAt", "durationMs");
    }

    @Test
    void logError_updateFails_doesNotThrow() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ToolAuditLog.class)))
                .thenThrow(new DataAccessResourceFailureException("timeout"));

        assertThatCode(() -> service.logError(AuditHandle.of("log-1", 0L), ToolErrorCode.EXECUTION_ERROR, "boom"))
                .doesNotThrowAnyException();
    }

    @Test
    void logSuccess_sanitizerThrows_doesNotThrow() {
        ResultSanitizer failing = mock(ResultSanitizer.class);
        when(failing.sanitize(any(Object.class))).thenThrow(new IllegalStateException("sanitizer broke"));
        ToolAuditService withFailingSanitizer = new ToolAuditService(mongoTemplate, repository, failing, objectMapper);

        assertThatCode(() -> withFailingSanitizer.logSuccess(AuditHandle.of("log-1", 0L),
                ToolResponse.of(Map.of("id", "item-1"))))
                .doesNotThrowAnyException();
        verify(mongoTemplate, never()).updateFirst(any(Query.class), any(Update.class), eq(ToolAuditLog.class));
    }

    @Test
    void logSuccess_selfReferencingResult_storedAsMarker() {
        service.logSuccess(AuditHandle.of("log-1", 0L), ToolResponse.of(new SelfReferencingData()));

        ArgumentCaptor<Update> captor = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), captor.capture(), eq(ToolAuditLog.class));
        Document set = (Document) captor.getValue().getUpdateObject().get("$set");
        assertThat(set.get("status")).isEqualTo(ToolAuditLog.Status.success);
        assertThat(set.get("result")).isEqualTo(ResultSanitizer.UNSERIALIZABLE);
    }

    @Test
    void findByOrg_withoutTool_queriesWholeOrg() {
        service.findByOrg("org-1", null);
        verify(repository).findByOrgIdOrderByStartedAtDesc("org-1");

        service.findByOrg("org-1", "brain.upsert_item");
        verify(repository).findByOrgIdAndToolNameOrderByStartedAtDesc("org-1", "brain.upsert_item");
    }
}
