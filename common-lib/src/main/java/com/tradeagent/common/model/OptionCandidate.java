package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A contract that survived strike filtering, carrying its computed score.
 */
public record OptionCandidate(
    @JsonProperty("strike") double strike,
    @JsonProperty("optionType") OptionType optionType,
    @JsonProperty("moneyness") Moneyness moneyness,
    @JsonProperty("bid") Double bid,
    @JsonProperty("ask") Double ask,
    @JsonProperty("ltp") Double ltp,
    @JsonProperty("delta") Double delta,
    @JsonProperty("gamma") Double gamma,
    @JsonProperty("theta") Double theta,
    @JsonProperty("vega") Double vega,
    @JsonProperty("iv") Double iv,
    @JsonProperty("ivChange") Double ivChange,
    @JsonProperty("ivTrend") String ivTrend,        // rising / falling / stable
    @JsonProperty("oiChange") Double oiChange,
    @JsonProperty("oiTrend") String oiTrend,        // building / unwinding / stable
    @JsonProperty("score") double score
) {
    /** Lifts a raw quote into an unscored candidate. */
    public static OptionCandidate from(OptionQuote q, Moneyness moneyness) {
        return new OptionCandidate(q.strike(), q.optionType(), moneyness,
            q.bid(), q.ask(), q.ltp(), q.delta(), q.gamma(), q.theta(), q.vega(),
            q.iv(), q.ivChange(), ivTrend(q.ivChange()), q.oiChange(), oiTrend(q.oiChange()), 0.0);
    }

    public OptionCandidate withScore(double newScore) {
        return new OptionCandidate(strike, optionType, moneyness, bid, ask, ltp, delta, gamma, theta, vega,
            iv, ivChange, ivTrend, oiChange, oiTrend, newScore);
    }

    public double spreadPct() {
        return OptionQuote.spreadPct(bid, ask);
    }

    static String ivTrend(Double change) {
        if (change == null) return "stable";
        if (change > 0.02) return "rising";
        if (change < -0.02) return "falling";
        return "stable";
    }

    static String oiTrend(Double change) {
        if (change == null) return "stable";
        if (change > 0.05) return "building";
        if (change < -0.05) return "unwinding";
        return "stable";
    }
}
