package com.tradeagent.orchestrator.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.exception.ReasoningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} over Ollama's {@code POST /api/chat} with {@code stream:false}.
 *
 * <p>Blocks on the reply; callers are expected to run off the event loop.
 */
public class OllamaChatClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatClient.class);
    private static final String COMPONENT = "Ollama";
    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String model;
    private final Duration timeout;

    public OllamaChatClient(WebClient ollamaWebClient, ObjectMapper objectMapper, String model, Duration timeout) {
        this.webClient    = ollamaWebClient;
        this.objectMapper = objectMapper;
        this.model        = model;
        this.timeout      = timeout;
    }

    @Override
    public ChatResponse chat(List<ChatMessage> messages, List<Map<String, Object>> tools) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages.stream().map(OllamaChatClient::toWire).toList());
        if (tools != null && !tools.isEmpty()) body.put("tools", tools);
        body.put("stream", false);

        String json;
        try {
            json = webClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
        } catch (WebClientResponseException e) {
            throw new ReasoningException(COMPONENT, "HTTP " + e.getStatusCode().value() + " from /api/chat", e);
        } catch (RuntimeException e) {
            throw new ReasoningException(COMPONENT, "chat request failed: " + e.getMessage(), e);
        }

        ChatResponse response = parseChatResponse(json);
        log.debug("[Ollama] Chat reply received. model={} toolCalls={} finishReason={}",
                  model, response.toolCalls().size(), response.finishReason());
        return response;
    }

    // ── wire format ──────────────────────────────────────────────────────────

    static Map<String, Object> toWire(ChatMessage message) {
        Map<String, Object> wire = new LinkedHashMap<>();
        wire.put("role", message.role());
        wire.put("content", message.content());
        if (message.hasToolCalls()) {
            wire.put("tool_calls", message.toolCalls().stream()
                .map(call -> Map.of("function", Map.of("name", call.name(), "arguments", call.arguments())))
                .toList());
        }
        if (message.toolName() != null) wire.put("name", message.toolName());
        return wire;
    }

    /**
     * Reads {@code message.content}, {@code message.tool_calls[].function} and the finish reason
     * ({@code done_reason}, else {@code "stop"} when {@code done} is true). Tool arguments may
     * arrive as an object or as a JSON string.
     */
    ChatResponse parseChatResponse(String json) {
        if (json == null || json.isBlank()) {
            throw new ReasoningException(COMPONENT, "empty response body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ReasoningException(COMPONENT, "unparseable response body", e);
        }
        if (root.hasNonNull("error")) {
            throw new ReasoningException(COMPONENT, root.path("error").asText());
        }

        JsonNode message = root.has("message") ? root.path("message") : root;
        String content = message.path("content").asText("");

        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode call : message.path("tool_calls")) {
            JsonNode function = call.has("function") ? call.path("function") : call;
            String name = function.path("name").asText("");
            if (name.isEmpty()) continue;
            toolCalls.add(ToolCall.of(name, readArguments(function.path("arguments"))));
        }

        String finishReason = root.hasNonNull("done_reason")
            ? root.path("done_reason").asText()
            : (root.path("done").asBoolean(false) ? "stop" : null);
        return new ChatResponse(content, toolCalls, finishReason);
    }

    private Map<String, Object> readArguments(JsonNode arguments) {
        try {
            if (arguments.isObject()) {
                return objectMapper.convertValue(arguments, ARGS_TYPE);
            }
            if (arguments.isTextual() && !arguments.asText().isBlank()) {
                return objectMapper.readValue(arguments.asText(), ARGS_TYPE);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("[Ollama] Unreadable tool arguments, using none. raw={}", arguments);
        }
        return Map.of();
    }
}
