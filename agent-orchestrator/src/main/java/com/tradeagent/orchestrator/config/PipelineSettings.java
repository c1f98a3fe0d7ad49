package com.tradeagent.orchestrator.config;

import com.tradeagent.orchestrator.tool.RegistryMode;

import java.time.LocalDate;
import java.util.Set;

/**
 * Pipeline configuration, built once at startup by {@link AgentConfig}.
 *
 * @param defaultSymbol symbol used by {@code GET /api/v1/pipeline/run}
 * @param llmEnabled    whether gate-passing runs are handed to the strategist
 * @param mode          tool registry mode for the reasoning loop
 * @param maxSpreadPct  widest bid/ask spread (% of mid) a strike may have
 * @param maxCandidates strikes kept after scoring
 * @param eventDates    scheduled high-impact event days
 */
public record PipelineSettings(
    String defaultSymbol,
    boolean llmEnabled,
    RegistryMode mode,
    double maxSpreadPct,
    int maxCandidates,
    Set<LocalDate> eventDates
) {
    public PipelineSettings {
        eventDates = eventDates == null ? Set.of() : Set.copyOf(eventDates);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings("NIFTY", false, RegistryMode.ALERT, 1.0, 2, Set.of());
    }

    public PipelineSettings withLlmEnabled(boolean enabled) {
        return new PipelineSettings(defaultSymbol, enabled, mode, maxSpreadPct, maxCandidates, eventDates);
    }
}
