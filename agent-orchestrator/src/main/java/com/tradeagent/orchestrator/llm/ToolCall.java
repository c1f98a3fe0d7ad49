package com.tradeagent.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A tool invocation requested by the model, natively or recovered from its text. */
public record ToolCall(
    @JsonProperty("name") String name,
    @JsonProperty("arguments") Map<String, Object> arguments
) {
    public ToolCall {
        arguments = arguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public static ToolCall of(String name, Map<String, Object> arguments) {
        return new ToolCall(name, arguments);
    }
}
