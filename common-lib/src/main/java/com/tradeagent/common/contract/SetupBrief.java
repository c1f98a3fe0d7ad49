package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** LLM-safe view of the 5-minute context. */
public record SetupBrief(
    @JsonProperty("setup") Setup setup,
    @JsonProperty("momentum") Momentum momentum,
    @JsonProperty("priceBehavior") String priceBehavior,
    @JsonProperty("vwapRelation") String vwapRelation,
    @JsonProperty("invalidations") List<String> invalidations,
    @JsonProperty("proceedToEntry") boolean proceedToEntry
) {

    public record Setup(
        @JsonProperty("type") String type,
        @JsonProperty("quality") String quality
    ) {}

    public record Momentum(
        @JsonProperty("rsi") Double rsi,
        @JsonProperty("rsiTrend") String rsiTrend,
        @JsonProperty("macdState") String macdState,
        @JsonProperty("aligned") boolean aligned
    ) {}
}
