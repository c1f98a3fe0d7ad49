package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one pipeline run produced. Always well-formed, even when the run failed.
 */
public record PipelineResult(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("runId") String runId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("recommendation") Recommendation recommendation,
    @JsonProperty("timeframeContexts") Map<String, TimeframeContext> timeframeContexts,
    @JsonProperty("optionCandidates") List<OptionCandidate> optionCandidates,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("gatesPassed") List<String> gatesPassed
) {
    public PipelineResult {
        timeframeContexts = timeframeContexts == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(timeframeContexts));
        optionCandidates = optionCandidates == null ? List.of() : List.copyOf(optionCandidates);
        errors = errors == null ? List.of() : List.copyOf(errors);
        gatesPassed = gatesPassed == null ? List.of() : List.copyOf(gatesPassed);
    }
}
