package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * LLM-safe view of the 15-minute context.
 */
public record TrendBrief(
    @JsonProperty("trend") Trend trend,
    @JsonProperty("structure") Structure structure,
    @JsonProperty("volatility") Volatility volatility,
    @JsonProperty("keyLevels") KeyLevels keyLevels,
    @JsonProperty("permission") Permission permission
) {

    public record Trend(
        @JsonProperty("direction") String direction,
        @JsonProperty("strength") String strength,
        @JsonProperty("adx") Double adx,
        @JsonProperty("diDiff") Double diDiff
    ) {}

    public record Structure(
        @JsonProperty("marketStructure") String marketStructure,
        @JsonProperty("lastBos") String lastBos,
        @JsonProperty("structureAge") int structureAge
    ) {}

    public record Volatility(
        @JsonProperty("atrTrend") String atrTrend,
        @JsonProperty("rangeState") String rangeState
    ) {}

    public record KeyLevels(
        @JsonProperty("vwapPosition") String vwapPosition,
        @JsonProperty("emaStack") String emaStack,
        @JsonProperty("distanceFromVwapPct") double distanceFromVwapPct
    ) {}

    public record Permission(
        @JsonProperty("optionsBuyingAllowed") boolean optionsBuyingAllowed,
        @JsonProperty("allowedDirection") String allowedDirection   // CE / PE / none
    ) {}
}
