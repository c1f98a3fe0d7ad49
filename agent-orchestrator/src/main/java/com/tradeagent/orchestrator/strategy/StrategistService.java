package com.tradeagent.orchestrator.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.model.Decision;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.Recommendation;
import com.tradeagent.orchestrator.config.LoopSettings;
import com.tradeagent.orchestrator.config.PipelineSettings;
import com.tradeagent.orchestrator.llm.LlmClient;
import com.tradeagent.orchestrator.reasoning.ConfidenceExtractor;
import com.tradeagent.orchestrator.reasoning.LoopResult;
import com.tradeagent.orchestrator.reasoning.ReasoningLoop;
import com.tradeagent.orchestrator.reasoning.ResponseParser;
import com.tradeagent.orchestrator.tool.ToolCatalog;
import com.tradeagent.orchestrator.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * LLM adjudication of a gate-passing run.
 *
 * <p>Runs a fresh {@link ReasoningLoop} over the brief and reads the model's answer either as
 * JSON ({@code decision, direction, strike, entry, stopLoss, targets, confidence, rationale})
 * or, failing that, by its stated confidence. The decision follows the confidence band, capped
 * by any decision the model states itself, and the direction always follows the 15m bias. Any failure returns the deterministic
 * recommendation unchanged.
 */
@Service
public class StrategistService implements RecommendationAdvisor {

    private static final Logger log = LoggerFactory.getLogger(StrategistService.class);

    private final LlmClient llmClient;
    private final ToolCatalog toolCatalog;
    private final ResponseParser responseParser;
    private final LoopSettings loopSettings;
    private final PipelineSettings pipelineSettings;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public StrategistService(LlmClient llmClient, ToolCatalog toolCatalog, ResponseParser responseParser,
                             LoopSettings loopSettings, PipelineSettings pipelineSettings,
                             ObjectMapper objectMapper, Clock clock) {
        this.llmClient        = llmClient;
        this.toolCatalog      = toolCatalog;
        this.responseParser   = responseParser;
        this.loopSettings     = loopSettings;
        this.pipelineSettings = pipelineSettings;
        this.objectMapper     = objectMapper;
        this.clock            = clock;
    }

    static String goalFor(String symbol) {
        return "Cross-validate trading signals and provide confidence score for " + symbol + " options";
    }

    @Override
    public Recommendation advise(String symbol, StructuredBrief brief, List<OptionCandidate> candidates,
                                 Recommendation fallback) {
        if (!brief.optionsBuyingAllowed()) {
            log.info("[Strategist] 15m permission denied. symbol={}", symbol);
            return Recommendation.noTrade("15m permission denied", fallback.gatesPassed());
        }

        try {
            ToolRegistry registry = toolCatalog.newRegistry(pipelineSettings.mode(), brief);
            ReasoningLoop loop = new ReasoningLoop(llmClient, registry, responseParser, loopSettings,
                                                   objectMapper, clock);
            LoopResult result = loop.run(goalFor(symbol), brief);

            if (!result.success()) {
                log.warn("[Strategist] Reasoning failed, using deterministic recommendation. symbol={} error={}",
                         symbol, result.error());
                return fallback;
            }

            Recommendation recommendation = interpret(result.answer(), candidates, fallback);
            log.info("[Strategist] Strategy evaluated. symbol={} decision={} confidence={} steps={} stopReason={}",
                     symbol, recommendation.decision(), recommendation.confidence(), result.steps(), result.stopReason());
            return recommendation;
        } catch (RuntimeException e) {
            log.error("[Strategist] Adjudication failed, using deterministic recommendation. symbol={} reason={}",
                      symbol, e.getMessage(), e);
            return fallback;
        }
    }

    // ── answer interpretation ────────────────────────────────────────────────

    Recommendation interpret(String answer, List<OptionCandidate> candidates, Recommendation fallback) {
        if (answer == null || answer.isBlank()) return fallback;

        JsonNode json = readJson(answer);
        if (json != null && json.hasNonNull("confidence")) {
            double confidence = normalise(json.path("confidence").asDouble(fallback.confidence()));
            Decision stated = Decision.parse(json.path("decision").asText(null));
            if (stated != null) {
                confidence = stated.capConfidence(confidence);
            }
            Double strike = json.path("strike").isNumber() ? json.path("strike").asDouble() : null;
            return Recommendation.of(
                fallback.direction(),
                resolveStrike(strike, candidates, fallback),
                json.path("entry").isNumber() ? json.path("entry").asDouble() : fallback.entry(),
                json.path("stopLoss").isNumber() ? json.path("stopLoss").asDouble() : fallback.stopLoss(),
                targets(json.path("targets"), fallback.targets()),
                confidence,
                json.path("rationale").asText(answer),
                fallback.gatesPassed());
        }

        Double stated = ConfidenceExtractor.extract(answer);
        double confidence = stated != null ? stated : fallback.confidence();
        return Recommendation.of(fallback.direction(), fallback.strike(), fallback.entry(), fallback.stopLoss(),
            fallback.targets(), confidence, answer.trim(), fallback.gatesPassed());
    }

    /** The model's answer as a JSON object, with fences and any leading prose removed. */
    private JsonNode readJson(String answer) {
        String cleaned = answer
            .replaceAll("```json", "")
            .replaceAll("```", "")
            .trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) return null;
        try {
            JsonNode node = objectMapper.readTree(cleaned.substring(start, end + 1));
            return node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("[Strategist] Answer is not JSON, reading stated confidence instead. reason={}", e.getOriginalMessage());
            return null;
        }
    }

    private static double normalise(double confidence) {
        return confidence > 1.0 ? confidence / 100.0 : confidence;
    }

    /** A strike the model made up is replaced by the best candidate. */
    static Double resolveStrike(Double strike, List<OptionCandidate> candidates, Recommendation fallback) {
        if (strike != null && candidates.stream().anyMatch(c -> c.strike() == strike)) {
            return strike;
        }
        return candidates.isEmpty() ? fallback.strike() : candidates.get(0).strike();
    }

    private static List<Double> targets(JsonNode node, List<Double> fallback) {
        if (!node.isArray() || node.isEmpty()) return fallback;
        List<Double> targets = new ArrayList<>();
        for (JsonNode t : node) {
            if (t.isNumber()) targets.add(t.asDouble());
        }
        return targets.isEmpty() ? fallback : targets;
    }
}
