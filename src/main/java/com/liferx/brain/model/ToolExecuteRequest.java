package com.liferx.brain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Body of POST /api/tools/execute.
 */
@Data
public class ToolExecuteRequest {

    @NotBlank(message = "toolName is required")
    private String toolName;

    private JsonNode args;

    private AssistantRunRequest.RequestContext context;
}
