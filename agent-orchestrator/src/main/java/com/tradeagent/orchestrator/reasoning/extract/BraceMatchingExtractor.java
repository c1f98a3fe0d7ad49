package com.tradeagent.orchestrator.reasoning.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.orchestrator.llm.ToolCall;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a JSON object embedded in prose, starting at a key that names a tool
 * ({@code name}, {@code tool_name}, {@code tool_calls}, {@code function}), and cuts it out by
 * counting braces outside string literals.
 */
public class BraceMatchingExtractor implements ToolCallExtractor {

    private static final Pattern OBJECT_START =
        Pattern.compile("\\{\\s*\"(?:name|tool_name|tool_calls|function)\"\\s*:");

    private final ObjectMapper objectMapper;

    public BraceMatchingExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<ToolCall> extract(String content, Set<String> toolNames) {
        if (content == null || content.isEmpty()) return Optional.empty();

        Matcher start = OBJECT_START.matcher(content);
        while (start.find()) {
            String json = balancedObject(content, start.start());
            if (json == null) continue;
            Optional<ToolCall> call = parse(json, toolNames);
            if (call.isPresent()) return call;
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

    /** The object starting at {@code from}, or {@code null} when its braces never balance. */
    static String balancedObject(String content, int from) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = from; i < content.length(); i++) {
            char c = content.charAt(i);
            if (escaped) {
                escaped = false;
                continue;
            }
            if (c == '\\') {
                escaped = inString;
                continue;
            }
            if (c == '"') {
                inString = !inString;
                continue;
            }
            if (inString) continue;
            if (c == '{') depth++;
            else if (c == '}') {
                depth--;
                if (depth == 0) return content.substring(from, i + 1);
            }
        }
        return null;
    }

    @Override
    public String name() {
        return "brace-matching";
    }
}
