package com.tradeagent.orchestrator.reasoning.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.orchestrator.llm.ToolCall;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The JSON shapes models use when they write a tool call as text:
 * <pre>
 * {"name": "...", "arguments": {...}}        also "parameters", "args", "params"
 * {"tool_calls": [{"function": {"name": "...", "arguments": ...}}]}
 * {"function": {"name": "...", "arguments": ...}}
 * </pre>
 * Arguments may be an object or a JSON string.
 */
final class ToolCallShapes {

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};
    private static final String[] ARGUMENT_FIELDS = {"arguments", "parameters", "args", "params"};

    private ToolCallShapes() {}

    static Optional<ToolCall> read(JsonNode node, Set<String> toolNames, ObjectMapper mapper) {
        if (node == null || !node.isObject()) return Optional.empty();

        JsonNode call = node;
        JsonNode toolCalls = node.path("tool_calls");
        if (toolCalls.isArray() && toolCalls.size() > 0) {
            call = toolCalls.get(0);
        }
        if (call.path("function").isObject()) {
            call = call.path("function");
        }

        String name = call.hasNonNull("name") ? call.path("name").asText() : call.path("tool_name").asText("");
        if (name.isBlank() || !toolNames.contains(name)) return Optional.empty();

        for (String field : ARGUMENT_FIELDS) {
            if (call.has(field)) {
                return Optional.of(ToolCall.of(name, arguments(call.path(field), mapper)));
            }
        }
        return Optional.of(ToolCall.of(name, Map.of()));
    }

    private static Map<String, Object> arguments(JsonNode node, ObjectMapper mapper) {
        try {
            if (node.isObject()) return mapper.convertValue(node, ARGS_TYPE);
            if (node.isTextual() && !node.asText().isBlank()) return mapper.readValue(node.asText(), ARGS_TYPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Map.of();
        }
        return Map.of();
    }
}
