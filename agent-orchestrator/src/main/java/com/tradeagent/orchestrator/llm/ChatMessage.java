package com.tradeagent.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One conversation turn. {@code toolCalls} is set only on assistant turns that requested
 * tools; {@code toolName} only on tool-result turns.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ChatMessage(
    @JsonProperty("role") String role,
    @JsonProperty("content") String content,
    @JsonProperty("toolCalls") List<ToolCall> toolCalls,
    @JsonProperty("toolName") String toolName
) {
    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL      = "tool";

    public ChatMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content, null, null);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content, null, null);
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(ASSISTANT, content, toolCalls, null);
    }

    public static ChatMessage tool(String toolName, String content) {
        return new ChatMessage(TOOL, content, null, toolName);
    }

    public boolean isAssistant() {
        return ASSISTANT.equals(role);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
