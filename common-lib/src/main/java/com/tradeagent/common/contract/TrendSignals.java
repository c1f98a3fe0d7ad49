package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Secondary 15-minute facts that feed {@link TrendContract}. Every field is optional;
 * absent values become neutral labels in the brief.
 */
public record TrendSignals(
    @JsonProperty("marketStructure") String marketStructure,   // higher_highs / lower_lows / range
    @JsonProperty("lastBos") String lastBos,                   // bullish / bearish / none
    @JsonProperty("structureAge") Integer structureAge,        // candles since last break of structure
    @JsonProperty("atrTrend") String atrTrend,
    @JsonProperty("rangeState") String rangeState,             // expansion / compression
    @JsonProperty("vwapPosition") String vwapPosition,         // above / below / inside
    @JsonProperty("vwapDistancePct") Double vwapDistancePct
) {
    public static TrendSignals none() {
        return new TrendSignals(null, null, null, null, null, null, null);
    }
}
