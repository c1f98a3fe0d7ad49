package com.tradeagent.orchestrator.reasoning;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeagent.orchestrator.tool.ToolResult;

import java.time.Instant;

/** One tool outcome remembered by the loop. */
public record MemoryEntry(
    @JsonProperty("tool") String tool,
    @JsonProperty("result") ToolResult result,
    @JsonProperty("timestamp") Instant timestamp
) {
    public boolean succeeded() {
        return result != null && result.success();
    }
}
