package com.tradeagent.orchestrator.reasoning.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.orchestrator.llm.ToolCall;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a tool call from a fenced JSON block, or from a reply that is a single JSON object.
 */
public class StructuredFieldExtractor implements ToolCallExtractor {

    private static final Pattern FENCED = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public StructuredFieldExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ToolCall> extract(String content, Set<String> toolNames) {
        if (content == null || content.isBlank()) return Optional.empty();

        Matcher fenced = FENCED.matcher(content);
        while (fenced.find()) {
            Optional<ToolCall> call = parse(fenced.group(1), toolNames);
            if (call.isPresent()) return call;
        }

        String trimmed = content.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return parse(trimmed, toolNames);
        }
        return Optional.empty();
    }

    private Optional<ToolCall> parse(String json, Set<String> toolNames) {
        try {
            return ToolCallShapes.read(objectMapper.readTree(json), toolNames, objectMapper);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    @Override
    public String name() {
        return "structured-field";
    }
}
