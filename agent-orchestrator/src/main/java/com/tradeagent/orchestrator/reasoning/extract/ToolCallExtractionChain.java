package com.tradeagent.orchestrator.reasoning.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.orchestrator.llm.ToolCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered recovery of tool calls written as text. The first extractor that produces a
 * registered call wins; when none does, the reply stays plain text.
 *
 * <p>Default order: structured field (fenced or whole-reply JSON), brace matching, keyword.
 * The chain runs once per reply.
 */
public class ToolCallExtractionChain {

    private static final Logger log = LoggerFactory.getLogger(ToolCallExtractionChain.class);

    private final List<ToolCallExtractor> extractors;

    public ToolCallExtractionChain(List<ToolCallExtractor> extractors) {
        this.extractors = List.copyOf(extractors);
    }

    public static ToolCallExtractionChain defaultChain(ObjectMapper objectMapper) {
        return new ToolCallExtractionChain(List.of(
            new StructuredFieldExtractor(objectMapper),
            new BraceMatchingExtractor(objectMapper),
            new KeywordToolNameExtractor()));
    }

    public Optional<ToolCall> extract(String content, Set<String> toolNames) {
        for (ToolCallExtractor extractor : extractors) {
            Optional<ToolCall> call = extractor.extract(content, toolNames);
            if (call.isPresent()) {
                log.debug("[Extraction] Tool call recovered from text. extractor={} tool={}",
                          extractor.name(), call.get().name());
                return call;
            }
        }
        return Optional.empty();
    }

    public List<ToolCallExtractor> extractors() {
        return extractors;
    }
}
