package com.tradeagent.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tradeagent.analysis.indicator.DefaultIndicatorCalculator;
import com.tradeagent.analysis.indicator.IndicatorCalculator;
import com.tradeagent.analysis.timeframe.SetupAnalyzer;
import com.tradeagent.analysis.timeframe.TrendAnalyzer;
import com.tradeagent.analysis.timeframe.TriggerAnalyzer;
import com.tradeagent.common.exception.ConfigurationException;
import com.tradeagent.orchestrator.reasoning.ResponseParser;
import com.tradeagent.orchestrator.reasoning.extract.ToolCallExtractionChain;
import com.tradeagent.orchestrator.tool.RegistryMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds the immutable settings records and the stateless analysis beans once at startup.
 */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    @Value("${agent.default-symbol:NIFTY}")
    private String defaultSymbol;

    @Value("${agent.mode:alert}")
    private String mode;

    @Value("${agent.llm-enabled:false}")
    private boolean llmEnabled;

    @Value("${agent.max-steps:3}")
    private int maxSteps;

    @Value("${agent.extra-steps:2}")
    private int extraSteps;

    @Value("${agent.max-tool-errors:5}")
    private int maxToolErrors;

    @Value("${agent.confidence-threshold:0.3}")
    private double confidenceThreshold;

    @Value("${options.max-spread-pct:1.0}")
    private double maxSpreadPct;

    @Value("${options.max-candidates:2}")
    private int maxCandidates;

    @Value("${market.event-dates:}")
    private String eventDates;

    // ── settings ─────────────────────────────────────────────────────────────

    @Bean
    public PipelineSettings pipelineSettings() {
        if (maxSpreadPct <= 0) {
            throw new ConfigurationException("options.max-spread-pct must be positive, got " + maxSpreadPct);
        }
        if (maxCandidates < 1) {
            throw new ConfigurationException("options.max-candidates must be at least 1, got " + maxCandidates);
        }
        PipelineSettings settings = new PipelineSettings(defaultSymbol.trim().toUpperCase(), llmEnabled,
            RegistryMode.fromConfig(mode), maxSpreadPct, maxCandidates, parseEventDates(eventDates));
        log.info("[AgentConfig] pipeline defaultSymbol={} llmEnabled={} mode={} maxSpreadPct={} maxCandidates={} eventDates={}",
                 settings.defaultSymbol(), settings.llmEnabled(), settings.mode(), settings.maxSpreadPct(),
                 settings.maxCandidates(), settings.eventDates().size());
        return settings;
    }

    @Bean
    public LoopSettings loopSettings() {
        return loopSettings(maxSteps, extraSteps, maxToolErrors, confidenceThreshold);
    }

    static LoopSettings loopSettings(int maxSteps, int extraSteps, int maxToolErrors, double confidenceThreshold) {
        if (maxSteps < 1 || extraSteps < 0) {
            throw new ConfigurationException(
                "agent.max-steps must be >= 1 and agent.extra-steps >= 0, got " + maxSteps + "/" + extraSteps);
        }
        if (maxToolErrors < 1) {
            throw new ConfigurationException("agent.max-tool-errors must be >= 1, got " + maxToolErrors);
        }
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new ConfigurationException(
                "agent.confidence-threshold must be within [0, 1], got " + confidenceThreshold);
        }
        LoopSettings defaults = LoopSettings.defaults();
        return new LoopSettings(maxSteps, extraSteps, maxToolErrors, confidenceThreshold,
            defaults.maxHistory(), defaults.maxMemory(), defaults.promptHistory(), defaults.promptMemory());
    }

    static Set<LocalDate> parseEventDates(String raw) {
        Set<LocalDate> dates = new LinkedHashSet<>();
        if (raw == null || raw.isBlank()) return dates;
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) continue;
            try {
                dates.add(LocalDate.parse(trimmed));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("market.event-dates has an invalid date: " + trimmed);
            }
        }
        return dates;
    }

    // ── shared infrastructure ────────────────────────────────────────────────

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    // ── analysis ─────────────────────────────────────────────────────────────

    @Bean
    public IndicatorCalculator indicatorCalculator() {
        return new DefaultIndicatorCalculator();
    }

    @Bean
    public TrendAnalyzer trendAnalyzer(IndicatorCalculator indicatorCalculator) {
        return new TrendAnalyzer(indicatorCalculator);
    }

    @Bean
    public SetupAnalyzer setupAnalyzer(IndicatorCalculator indicatorCalculator) {
        return new SetupAnalyzer(indicatorCalculator);
    }

    @Bean
    public TriggerAnalyzer triggerAnalyzer(IndicatorCalculator indicatorCalculator) {
        return new TriggerAnalyzer(indicatorCalculator);
    }

    // ── reasoning ────────────────────────────────────────────────────────────

    @Bean
    public ResponseParser responseParser(ObjectMapper objectMapper) {
        return new ResponseParser(ToolCallExtractionChain.defaultChain(objectMapper));
    }
}
