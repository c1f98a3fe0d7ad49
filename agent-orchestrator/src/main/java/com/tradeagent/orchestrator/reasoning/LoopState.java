package com.tradeagent.orchestrator.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradeagent.orchestrator.config.LoopSettings;
import com.tradeagent.orchestrator.llm.ChatMessage;
import com.tradeagent.orchestrator.tool.RegistryMode;
import com.tradeagent.orchestrator.tool.ToolResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Immutable state of one reasoning loop.
 *
 * <p>Only {@link #appendModelResponse}, {@link #appendToolResult} and {@link #putCached}
 * produce new states; every other method is a read. History and memory are bounded by
 * {@link LoopSettings}.
 */
public final class LoopState {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private static final Pattern ALPHANUMERIC = Pattern.compile("[A-Za-z0-9]+");

    private final String goal;
    private final int stepCount;
    private final List<ChatMessage> history;
    private final List<MemoryEntry> memory;
    private final int toolErrorCount;
    private final Map<CacheKey, ToolResult> cache;
    private final RegistryMode mode;
    private final LoopSettings settings;
    private final Clock clock;

    private LoopState(String goal, int stepCount, List<ChatMessage> history, List<MemoryEntry> memory,
                      int toolErrorCount, Map<CacheKey, ToolResult> cache, RegistryMode mode,
                      LoopSettings settings, Clock clock) {
        this.goal = goal;
        this.stepCount = stepCount;
        this.history = Collections.unmodifiableList(history);
        this.memory = Collections.unmodifiableList(memory);
        this.toolErrorCount = toolErrorCount;
        this.cache = Collections.unmodifiableMap(cache);
        this.mode = mode;
        this.settings = settings;
        this.clock = clock;
    }

    public static LoopState initial(String goal, RegistryMode mode, LoopSettings settings, Clock clock) {
        return new LoopState(goal, 0, List.of(), List.of(), 0, Map.of(), mode, settings, clock);
    }

    // ── transitions ──────────────────────────────────────────────────────────

    /** Counts a step and records the assistant turn. */
    public LoopState appendModelResponse(ParsedResponse response) {
        List<ChatMessage> next = new ArrayList<>(history);
        next.add(ChatMessage.assistant(response.content(),
            response.isToolCall() ? List.of(response.toolCall()) : List.of()));
        return new LoopState(goal, stepCount + 1, tail(next, settings.maxHistory()), memory,
                             toolErrorCount, cache, mode, settings, clock);
    }

    /**
     * Records a tool outcome in memory and as a tool turn in history. Failed results count
     * towards the error threshold.
     *
     * @param cached whether the result was served from the cache rather than executed
     */
    public LoopState appendToolResult(String toolName, ToolResult result, boolean cached) {
        List<MemoryEntry> nextMemory = new ArrayList<>(memory);
        nextMemory.add(new MemoryEntry(toolName, result, clock.instant()));

        List<ChatMessage> nextHistory = new ArrayList<>(history);
        nextHistory.add(ChatMessage.tool(toolName, toolContent(result, cached)));

        return new LoopState(goal, stepCount, tail(nextHistory, settings.maxHistory()),
                             tail(nextMemory, settings.maxMemory()),
                             toolErrorCount + (result.success() ? 0 : 1), cache, mode, settings, clock);
    }

    public LoopState putCached(CacheKey key, ToolResult result) {
        Map<CacheKey, ToolResult> next = new LinkedHashMap<>(cache);
        next.put(key, result);
        return new LoopState(goal, stepCount, history, memory, toolErrorCount, next, mode, settings, clock);
    }

    // ── reads ────────────────────────────────────────────────────────────────

    public Optional<ToolResult> getCached(CacheKey key) {
        return Optional.ofNullable(cache.get(key));
    }

    /**
     * Canonical key of a tool call. Argument keys are trimmed, string values made only of
     * letters and digits are upper-cased, nested maps and lists are canonicalised the same
     * way, and the result is serialised with sorted keys.
     */
    public static CacheKey cacheKey(String toolName, Map<String, ?> args) {
        Object canonical = canonicalize(args == null ? Map.of() : args);
        try {
            return new CacheKey(toolName, CANONICAL.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Arguments of " + toolName + " are not serialisable", e);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            map.forEach((k, v) -> sorted.put(String.valueOf(k).trim(), canonicalize(v)));
            return sorted;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(LoopState::canonicalize).toList();
        }
        if (value instanceof String s && ALPHANUMERIC.matcher(s).matches()) {
            return s.toUpperCase();
        }
        return value;
    }

    /**
     * User prompt for the next step: goal, the brief, the latest tool outcomes and the step
     * counter.
     */
    public String buildPrompt(String briefJson) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Goal: ").append(goal).append("\n\n");
        prompt.append("Trading brief (pre-computed facts, all gates passed):\n")
              .append(briefJson).append("\n\n");

        if (!memory.isEmpty()) {
            prompt.append("Recent tool results:\n");
            for (MemoryEntry entry : tail(memory, settings.promptMemory())) {
                prompt.append("- ").append(entry.tool()).append(": ")
                      .append(entry.succeeded() ? "success" : "error: " + entry.result().error())
                      .append('\n');
            }
            prompt.append('\n');
        }

        prompt.append("Step ").append(stepCount + 1).append('/').append(settings.maxSteps()).append("\n\n");
        prompt.append("Call one tool if you need to verify something, otherwise give your final answer.");
        return prompt.toString();
    }

    /** The history messages replayed to the model on the next call. */
    public List<ChatMessage> promptHistory() {
        return tail(history, settings.promptHistory());
    }

    private String toolContent(ToolResult result, boolean cached) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("success", result.success());
        if (result.success()) {
            content.put("status", "SUCCESS");
            content.put("data", result.data());
            content.put("message", cached
                ? "Cached result: you already have this data, do not call this tool again with the same arguments."
                : "Tool executed successfully.");
        } else {
            content.put("status", "ERROR");
            content.put("error", result.error());
            content.put("message", "Tool execution failed.");
        }
        try {
            return CANONICAL.writeValueAsString(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result is not serialisable", e);
        }
    }

    private static <T> List<T> tail(List<T> list, int max) {
        if (list.size() <= max) return new ArrayList<>(list);
        return new ArrayList<>(list.subList(list.size() - max, list.size()));
    }

    public String goal()                { return goal; }
    public int stepCount()              { return stepCount; }
    public List<ChatMessage> history()  { return history; }
    public List<MemoryEntry> memory()   { return memory; }
    public int toolErrorCount()         { return toolErrorCount; }
    public int cacheSize()              { return cache.size(); }
    public RegistryMode mode()          { return mode; }
}
