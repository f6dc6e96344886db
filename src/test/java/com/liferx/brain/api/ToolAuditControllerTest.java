package com.liferx.brain.api;

import com.liferx.brain.audit.ToolAuditLog;
import com.liferx.brain.audit.ToolAuditService;
import com.liferx.brain.config.AgentProperties;
import com.liferx.brain.exception.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ToolAuditControllerTest {

    private ToolAuditService auditService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.setInternalSecret("s3cret");
        auditService = mock(ToolAuditService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new ToolAuditController(auditService, new InternalSecretVerifier(properties)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void bySession_returnsEntries() throws Exception {
        ToolAuditLog entry = ToolAuditLog.builder()
                .sessionId("s-1")
                .toolName("brain.search_items")
                .status(ToolAuditLog.Status.success)
                .build();
        when(auditService.findBySession("s-1")).thenReturn(List.of(entry));

        mockMvc.perform(get("/api/v1/tool-logs/session/s-1").header(InternalSecretVerifier.HEADER, "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].toolName").value("brain.search_items"))
                .andExpect(jsonPath("$[0].status").value("success"));
    }

    @Test
    void byOrg_passesToolFilter() throws Exception {
        when(auditService.findByOrg("org-1", "brain.upsert_item")).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/tool-logs/org/org-1")
                        .param("tool", "brain.upsert_item")
                        .header(InternalSecretVerifier.HEADER, "s3cret"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(auditService).findByOrg("org-1", "brain.upsert_item");
    }

    @Test
    void withoutSecret_unauthorized() throws Exception {
        mockMvc.perform(get("/api/v1/tool-logs/session/s-1"))
                .andExpect(status().isUnauthorized());

        verify(auditService, never()).findBySession(any());
    }
}
