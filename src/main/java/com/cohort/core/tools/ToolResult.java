package com.cohort.core.tools;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of one tool execution, serialized back to the model as JSON.
 * Validation problems are failures, never exceptions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(boolean success, Object data, String error) {

    public static ToolResult success(Object data) {
        return new ToolResult(true, data, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }
}
