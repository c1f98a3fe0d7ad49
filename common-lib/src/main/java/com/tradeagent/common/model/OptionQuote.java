package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One side (CE or PE) of one strike in a raw option chain, as delivered by the broker.
 * Any field the broker did not send is {@code null}.
 *
 * <p>{@code ivChange} and {@code oiChange} are fractional changes against the previous
 * session (0.05 = +5%).
 */
public record OptionQuote(
    @JsonProperty("strike") double strike,
    @JsonProperty("optionType") OptionType optionType,
    @JsonProperty("bid") Double bid,
    @JsonProperty("ask") Double ask,
    @JsonProperty("ltp") Double ltp,
    @JsonProperty("delta") Double delta,
    @JsonProperty("gamma") Double gamma,
    @JsonProperty("theta") Double theta,
    @JsonProperty("vega") Double vega,
    @JsonProperty("iv") Double iv,
    @JsonProperty("ivChange") Double ivChange,
    @JsonProperty("oi") Long oi,
    @JsonProperty("oiChange") Double oiChange,
    @JsonProperty("volume") Long volume
) {
    /** Spread as a percentage of the mid price; 100 when a side is missing or the mid is zero. */
    public static double spreadPct(Double bid, Double ask) {
        if (bid == null || ask == null) return 100.0;
        double mid = (bid + ask) / 2.0;
        if (mid == 0.0) return 100.0;
        return Math.abs(ask - bid) / mid * 100.0;
    }

    public double spreadPct() {
        return spreadPct(bid, ask);
    }

    public boolean hasTwoSidedQuote() {
        return bid != null && ask != null && bid > 0 && ask > 0;
    }
}
