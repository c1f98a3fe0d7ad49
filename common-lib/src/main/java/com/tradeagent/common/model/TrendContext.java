package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 15-minute trend context. Its gate is {@link #tradeAllowed()}: a directional bias on
 * complete data whose ADX, when known, is not below the trending threshold.
 */
public record TrendContext(
    @JsonProperty("status") ContextStatus status,
    @JsonProperty("bias") Bias bias,
    @JsonProperty("strength") String strength,          // strong / moderate / weak / unknown
    @JsonProperty("volatility") String volatility,      // expanding / contracting / stable
    @JsonProperty("ema9") Double ema9,
    @JsonProperty("ema21") Double ema21,
    @JsonProperty("adx") Double adx,
    @JsonProperty("diDiff") Double diDiff,
    @JsonProperty("atr") Double atr,
    @JsonProperty("vwap") Double vwap,
    @JsonProperty("latestClose") Double latestClose,
    @JsonProperty("tradeAllowed") boolean tradeAllowed,
    @JsonProperty("error") String error
) implements TimeframeContext {

    public static TrendContext noData() {
        return new TrendContext(ContextStatus.NO_DATA, Bias.NEUTRAL, "unknown", "unknown",
            null, null, null, null, null, null, null, false, null);
    }

    public static TrendContext error(String message) {
        return new TrendContext(ContextStatus.ERROR, Bias.NEUTRAL, "unknown", "unknown",
            null, null, null, null, null, null, null, false, message);
    }

    @Override
    @JsonProperty("timeframe")
    public Timeframe timeframe() {
        return Timeframe.FIFTEEN_MINUTE;
    }

    @Override
    public boolean gatePassed() {
        return status.isComplete() && tradeAllowed;
    }
}
