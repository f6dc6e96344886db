package com.liferx.brain.tool;

public enum ToolErrorCode {
    TOOL_NOT_FOUND,
    WRITE_NOT_ALLOWED,
    VALIDATION_ERROR,
    EXECUTION_ERROR
}
