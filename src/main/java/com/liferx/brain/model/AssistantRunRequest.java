package com.liferx.brain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class AssistantRunRequest {

    @NotEmpty(message = "messages must not be empty")
    @Valid
    private List<ClientMessage> messages;

    /** Optional; org_id falls back to agent.default-org-id */
    private RequestContext context;

    @Data
    public static class ClientMessage {

        @NotBlank(message = "role is required")
        @Pattern(regexp = "user|assistant", message = "role must be 'user' or 'assistant'")
        private String role;

        private String content;
    }

    @Data
    public static class RequestContext {

        @JsonProperty("org_id")
        private String orgId;

        @JsonProperty("session_id")
        private String sessionId;

        @JsonProperty("user_id")
        private String userId;

        private boolean allowWrites;

        /** Free-form caller annotations, copied into the audit log */
        private Map<String, Object> metadata;
    }
}
