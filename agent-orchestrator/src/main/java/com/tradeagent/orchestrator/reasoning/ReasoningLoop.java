package com.tradeagent.orchestrator.reasoning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.exception.ReasoningException;
import com.tradeagent.orchestrator.config.LoopSettings;
import com.tradeagent.orchestrator.llm.ChatMessage;
import com.tradeagent.orchestrator.llm.ChatResponse;
import com.tradeagent.orchestrator.llm.LlmClient;
import com.tradeagent.orchestrator.llm.ToolCall;
import com.tradeagent.orchestrator.tool.RegistryMode;
import com.tradeagent.orchestrator.tool.ToolDefinition;
import com.tradeagent.orchestrator.tool.ToolRegistry;
import com.tradeagent.orchestrator.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * ReAct loop: ask the model, run the tool it picks, feed the result back, and stop when
 * {@link StopConditions} says so. One instance per run; not thread-safe.
 *
 * <p>Each step sends the system prompt, a fresh user prompt built from {@link LoopState} and
 * the most recent history. Tool results are cached per run by {@link LoopState#cacheKey}; a
 * repeated call is answered from the cache without invoking the handler.
 */
public class ReasoningLoop {

    private static final Logger log = LoggerFactory.getLogger(ReasoningLoop.class);

    static final int MIN_FINAL_TEXT_LENGTH = 100;

    private static final Pattern CONCLUDING = Pattern.compile(
        "final.*answer|conclusion|recommendation|summary|analysis|based on|according to"
            + "|the data shows|indicators show", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOOL_CALL_TEXT = Pattern.compile(
        "^\\s*(?:```json\\s*)?\\{\\s*\"(?:name|tool_calls|function)\"");
    private static final Pattern TOOL_INTENT = Pattern.compile(
        "would recommend calling|I should call|need to call|I will call", Pattern.CASE_INSENSITIVE);
    private static final Pattern ANALYSIS_WORDS = Pattern.compile(
        "analysis|conclusion|summary|recommendation|based on|according to", Pattern.CASE_INSENSITIVE);

    private final LlmClient llmClient;
    private final ToolRegistry registry;
    private final ResponseParser parser;
    private final LoopSettings settings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReasoningLoop(LlmClient llmClient, ToolRegistry registry, ResponseParser parser,
                         LoopSettings settings, ObjectMapper objectMapper, Clock clock) {
        this.llmClient    = llmClient;
        this.registry     = registry;
        this.parser       = parser;
        this.settings     = settings;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    public LoopResult run(String goal, StructuredBrief brief) {
        String briefJson = briefJson(brief);
        List<Map<String, Object>> tools = registry.toSchema();
        Set<String> toolNames = registry.enabledToolNames();
        String systemPrompt = systemPrompt();

        LoopState state = LoopState.initial(goal, registry.mode(), settings, clock);
        log.info("[ReasoningLoop] Starting. mode={} tools={} maxSteps={}", registry.mode(), toolNames, settings.maxSteps());

        while (true) {
            ChatResponse reply;
            try {
                reply = llmClient.chat(messages(systemPrompt, state, briefJson), tools);
            } catch (ReasoningException e) {
                log.warn("[ReasoningLoop] Model call failed. step={} error={}", state.stepCount() + 1, e.getMessage());
                return LoopResult.failed(e.getMessage(), state.stepCount(), state.memory());
            }

            ParsedResponse parsed = parser.parse(reply, toolNames);
            if (parsed.type() == ResponseType.TEXT && readsAsConclusion(parsed.content())) {
                parsed = parsed.asFinal();
            }
            state = state.appendModelResponse(parsed);

            LoopPhase phase = phaseOf(parsed);
            log.info("[ReasoningLoop] Step completed. step={} phase={}", state.stepCount(), phase);

            if (phase == LoopPhase.TOOL_CALL) {
                state = dispatch(state, parsed.toolCall());
            }

            StopDecision decision = StopConditions.evaluate(state, parsed, settings);
            if (decision.stop()) {
                return finish(state, decision.reason());
            }
        }
    }

    // ── steps ────────────────────────────────────────────────────────────────

    private LoopState dispatch(LoopState state, ToolCall call) {
        CacheKey key = LoopState.cacheKey(call.name(), call.arguments());
        Optional<ToolResult> cached = state.getCached(key);
        if (cached.isPresent()) {
            log.info("[ReasoningLoop] Cache hit. tool={} key={}", call.name(), key);
            return state.appendToolResult(call.name(), cached.get(), true);
        }

        ToolResult result = registry.execute(call.name(), call.arguments());
        LoopState next = state.appendToolResult(call.name(), result, false);
        if (result.success()) {
            next = next.putCached(key, result);
        } else {
            log.warn("[ReasoningLoop] Tool failed. tool={} error={} errorCount={}/{}",
                     call.name(), result.error(), next.toolErrorCount(), settings.maxToolErrors());
        }
        return next;
    }

    private List<ChatMessage> messages(String systemPrompt, LoopState state, String briefJson) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(systemPrompt));
        messages.add(ChatMessage.user(state.buildPrompt(briefJson)));
        messages.addAll(state.promptHistory());
        return messages;
    }

    private LoopResult finish(LoopState state, String stopReason) {
        String answer = extractFinalAnswer(state);
        long failed = state.memory().stream().filter(m -> !m.succeeded()).count();
        log.info("[ReasoningLoop] Finished. reason={} steps={} toolsUsed={} failedTools={}",
                 stopReason, state.stepCount(), state.memory().size(), failed);
        return LoopResult.completed(answer, state.stepCount(), stopReason, state.memory());
    }

    // ── text handling ────────────────────────────────────────────────────────

    static boolean readsAsConclusion(String content) {
        return content.length() > MIN_FINAL_TEXT_LENGTH
            && !TOOL_CALL_TEXT.matcher(content).find()
            && CONCLUDING.matcher(content).find();
    }

    private static LoopPhase phaseOf(ParsedResponse parsed) {
        return switch (parsed.type()) {
            case TOOL_CALL -> LoopPhase.TOOL_CALL;
            case FINAL     -> LoopPhase.FINAL_ANSWER;
            case TEXT      -> LoopPhase.TEXT_CONTINUE;
        };
    }

    /**
     * The last substantive assistant message that is not a tool call, else a summary of
     * tool activity.
     */
    static String extractFinalAnswer(LoopState state) {
        List<ChatMessage> history = state.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            ChatMessage message = history.get(i);
            if (!message.isAssistant() || message.hasToolCalls()) continue;
            String content = message.content().trim();
            if (content.isEmpty()) continue;
            if (TOOL_CALL_TEXT.matcher(content).find() || TOOL_INTENT.matcher(content).find()) continue;
            if (content.length() > 50 || ANALYSIS_WORDS.matcher(content).find()) {
                return content;
            }
        }

        if (!state.memory().isEmpty()) {
            String summary = state.memory().stream()
                .map(m -> m.tool() + ": " + (m.succeeded() ? "success" : "error"))
                .collect(Collectors.joining(", "));
            return "Agent executed tools (" + summary + ") but didn't provide a final analysis.";
        }
        return "No final answer provided.";
    }

    // ── prompts ──────────────────────────────────────────────────────────────

    private String systemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an options trading analyst for Indian index derivatives.\n")
              .append("You receive a brief of pre-computed facts for a setup that already passed every ")
              .append("deterministic gate. Cross-check it and rate your confidence.\n\n")
              .append("Available tools:\n");
        for (ToolDefinition tool : registry.enabledTools()) {
            prompt.append("- ").append(tool.name()).append(": ").append(tool.description());
            if (!tool.parameters().isEmpty()) {
                prompt.append(" (params: ")
                      .append(tool.parameters().entrySet().stream()
                          .map(e -> e.getKey() + ": " + e.getValue().type().schemaName())
                          .collect(Collectors.joining(", ")))
                      .append(')');
            }
            prompt.append('\n');
        }
        prompt.append("\nRules:\n")
              .append("- Call at most one tool per reply and wait for its result.\n")
              .append("- Never repeat a call you already made; a cached result means you have that data.\n")
              .append("- You have ").append(settings.maxSteps()).append(" steps.\n")
              .append("- When done, start with \"Final answer:\" and reply with JSON: ")
              .append("{\"decision\", \"direction\", \"strike\", \"entry\", \"stopLoss\", \"targets\", ")
              .append("\"confidence\" (0-1), \"rationale\"}.\n\n")
              .append("Mode: ").append(registry.mode())
              .append(registry.mode() == RegistryMode.ALERT
                  ? " (execution tools disabled, analysis only)"
                  : " (execution tools enabled)");
        return prompt.toString();
    }

    private String briefJson(StructuredBrief brief) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(brief);
        } catch (JsonProcessingException e) {
            throw new ReasoningException("ReasoningLoop", "brief is not serialisable", e);
        }
    }
}
