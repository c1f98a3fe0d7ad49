package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/** LLM-safe view of one surviving option candidate. */
public record StrikeBrief(
    @JsonProperty("strike") double strike,
    @JsonProperty("type") String type,
    @JsonProperty("moneyness") String moneyness,
    @JsonProperty("premium") Double premium,
    @JsonProperty("spreadPct") double spreadPct,
    @JsonProperty("delta") Double delta,
    @JsonProperty("gamma") Double gamma,
    @JsonProperty("theta") Double theta,
    @JsonProperty("vega") Double vega,
    @JsonProperty("iv") Double iv,
    @JsonProperty("ivTrend") String ivTrend,
    @JsonProperty("oiTrend") String oiTrend,
    @JsonProperty("thetaRisk") String thetaRisk,   // high / acceptable
    @JsonProperty("liquidity") String liquidity,   // good / poor
    @JsonProperty("score") double score
) {}
