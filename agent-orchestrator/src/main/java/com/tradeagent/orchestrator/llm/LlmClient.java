package com.tradeagent.orchestrator.llm;

import com.tradeagent.common.exception.ReasoningException;

import java.util.List;
import java.util.Map;

/**
 * Chat endpoint with function calling.
 */
public interface LlmClient {

    /**
     * @param messages conversation, oldest first
     * @param tools    function descriptors; empty to disable tool calling
     * @throws ReasoningException on transport failure, non-2xx status or an unreadable body
     */
    ChatResponse chat(List<ChatMessage> messages, List<Map<String, Object>> tools);
}
