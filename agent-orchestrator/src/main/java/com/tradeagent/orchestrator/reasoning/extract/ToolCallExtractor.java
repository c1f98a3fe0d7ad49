package com.tradeagent.orchestrator.reasoning.extract;

import com.tradeagent.orchestrator.llm.ToolCall;

import java.util.Optional;
import java.util.Set;

/**
 * One link of the text-to-tool-call chain. Implementations only return calls whose name is
 * in {@code toolNames}.
 */
public interface ToolCallExtractor {

    Optional<ToolCall> extract(String content, Set<String> toolNames);

    String name();
}
