package com.tradeagent.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of one tool execution. Exactly one of {@code data} and {@code error} is meaningful.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    @JsonProperty("success") boolean success,
    @JsonProperty("data") Object data,
    @JsonProperty("error") String error
) {
    public static ToolResult ok(Object data) {
        return new ToolResult(true, data, null);
    }

    public static ToolResult failure(String error) {
        return new ToolResult(false, null, error);
    }
}
