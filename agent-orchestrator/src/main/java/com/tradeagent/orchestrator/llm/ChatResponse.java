package com.tradeagent.orchestrator.llm;

import java.util.List;

/** Parsed reply of the chat endpoint. */
public record ChatResponse(String content, List<ToolCall> toolCalls, String finishReason) {

    public ChatResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatResponse text(String content) {
        return new ChatResponse(content, List.of(), "stop");
    }

    public static ChatResponse toolCall(ToolCall call) {
        return new ChatResponse("", List.of(call), "tool_calls");
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
