package com.liferx.brain.tool;

/**
 * Outcome of one executor call. The executor never throws; every failure mode
 * is one of the {@link ToolErrorCode}s carried by a {@link Failure}.
 */
public interface ToolExecutionResult {

    String tool();

    boolean isOk();

    record Success(String tool, ToolResponse response) implements ToolExecutionResult {
        @Override
        public boolean isOk() {
            return true;
        }
    }

    record Failure(String tool, ToolErrorCode code, String message, Object details)
            implements ToolExecutionResult {
        @Override
        public boolean isOk() {
            return false;
        }
    }

    static ToolExecutionResult success(String tool, ToolResponse response) {
        return new Success(tool, response);
    }

    static ToolExecutionResult failure(String tool, ToolErrorCode code, String message) {
        return new Failure(tool, code, message, null);
    }

    static ToolExecutionResult failure(String tool, ToolErrorCode code, String message, Object details) {
        return new Failure(tool, code, message, details);
    }
}
