package com.tradeagent.common.contract;

import com.tradeagent.common.model.OptionCandidate;

import java.util.List;

/**
 * Turns scored {@link OptionCandidate}s into {@link StrikeBrief}s.
 *
 * <ul>
 *   <li>spread% = |ask − bid| / mid × 100, 100 when a side is missing or mid is 0</li>
 *   <li>theta risk is {@code high} when |theta| &gt; 10</li>
 *   <li>liquidity is {@code good} when spread% &lt; 1.0</li>
 * </ul>
 */
public final class OptionStrikeContract {

    public static final double THETA_RISK_LIMIT     = 10.0;
    public static final double GOOD_LIQUIDITY_SPREAD = 1.0;

    private OptionStrikeContract() {}

    public static List<StrikeBrief> build(List<OptionCandidate> candidates) {
        if (candidates == null) return List.of();
        return candidates.stream().map(OptionStrikeContract::build).toList();
    }

    public static StrikeBrief build(OptionCandidate c) {
        double spread = round2(c.spreadPct());
        return new StrikeBrief(
            c.strike(),
            c.optionType() != null ? c.optionType().name() : "unknown",
            c.moneyness() != null ? c.moneyness().name() : "unknown",
            c.ltp(),
            spread,
            c.delta(), c.gamma(), c.theta(), c.vega(), c.iv(),
            TrendContract.orDefault(c.ivTrend(), "stable"),
            TrendContract.orDefault(c.oiTrend(), "stable"),
            thetaRisk(c.theta()),
            spread < GOOD_LIQUIDITY_SPREAD ? "good" : "poor",
            c.score());
    }

    static String thetaRisk(Double theta) {
        if (theta == null) return "acceptable";
        return Math.abs(theta) > THETA_RISK_LIMIT ? "high" : "acceptable";
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
