package com.liferx.brain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.liferx.brain.tool.ToolExecutionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolExecuteResponse {

    private boolean ok;
    private String tool;
    private Object data;
    private Map<String, Object> explainability;
    private ErrorBody error;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        private String code;
        private String message;
        private Object details;
    }

    public static ToolExecuteResponse from(ToolExecutionResult result) {
        if (result instanceof ToolExecutionResult.Success success) {
            return ToolExecuteResponse.builder()
                    .ok(true)
                    .tool(success.tool())
                    .data(success.response().getData())
                    .explainability(success.response().getExplainability())
                    .build();
        }
        ToolExecutionResult.Failure failure = (ToolExecutionResult.Failure) result;
        return ToolExecuteResponse.builder()
                .ok(false)
                .tool(failure.tool())
                .error(new ErrorBody(failure.code().name(), failure.message(), failure.details()))
                .build();
    }
}
