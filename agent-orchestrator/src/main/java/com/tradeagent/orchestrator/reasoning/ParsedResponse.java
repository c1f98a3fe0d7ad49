package com.tradeagent.orchestrator.reasoning;

import com.tradeagent.orchestrator.llm.ToolCall;

/**
 * A model reply classified for the loop. {@code toolCall} is set only for
 * {@link ResponseType#TOOL_CALL}; {@code confidence} is whatever the text reported, if anything.
 */
public record ParsedResponse(
    ResponseType type,
    String content,
    ToolCall toolCall,
    Double confidence,
    String finishReason
) {
    public ParsedResponse {
        content = content == null ? "" : content;
    }

    public static ParsedResponse toolCall(ToolCall call, String content, Double confidence) {
        return new ParsedResponse(ResponseType.TOOL_CALL, content, call, confidence, "tool_calls");
    }

    public static ParsedResponse text(String content, Double confidence, String finishReason) {
        return new ParsedResponse(ResponseType.TEXT, content, null, confidence, finishReason);
    }

    public static ParsedResponse finalAnswer(String content, Double confidence) {
        return new ParsedResponse(ResponseType.FINAL, content, null, confidence, "stop");
    }

    public ParsedResponse asFinal() {
        return new ParsedResponse(ResponseType.FINAL, content, null, confidence, finishReason);
    }

    public boolean isToolCall() {
        return type == ResponseType.TOOL_CALL;
    }

    public boolean isFinal() {
        return type == ResponseType.FINAL;
    }
}
