package com.tradeagent.common.contract;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.ContextStatus;
import com.tradeagent.common.model.TrendContext;

/**
 * Turns a {@link TrendContext} into its {@link TrendBrief}. Pure, never throws on missing
 * indicators.
 *
 * <h3>Strength ladder (ADX)</h3>
 * <pre>
 *   ≥ 25  strong
 *   ≥ 20  moderate
 *   else  weak      (absent → unknown)
 * </pre>
 *
 * <h3>Permission</h3>
 * Options buying is allowed only when the context is complete, the bias is directional,
 * and ADX, if known, is at least {@link #MIN_TRENDING_ADX}.
 */
public final class TrendContract {

    public static final double STRONG_ADX       = 25.0;
    public static final double MIN_TRENDING_ADX = 20.0;

    private TrendContract() {}

    public static TrendBrief build(TrendContext ctx, TrendSignals signals) {
        TrendSignals s = signals != null ? signals : TrendSignals.none();
        Bias bias = ctx.bias() != null ? ctx.bias() : Bias.NEUTRAL;

        TrendBrief.Trend trend = new TrendBrief.Trend(
            direction(bias), strengthLabel(ctx.adx()), ctx.adx(), ctx.diDiff());

        TrendBrief.Structure structure = new TrendBrief.Structure(
            orDefault(s.marketStructure(), "range"),
            orDefault(s.lastBos(), "none"),
            s.structureAge() != null ? s.structureAge() : 0);

        TrendBrief.Volatility volatility = new TrendBrief.Volatility(
            orDefault(s.atrTrend(), orDefault(ctx.volatility(), "stable")),
            orDefault(s.rangeState(), "compression"));

        TrendBrief.KeyLevels keyLevels = new TrendBrief.KeyLevels(
            orDefault(s.vwapPosition(), "inside"),
            emaStack(ctx.ema9(), ctx.ema21()),
            s.vwapDistancePct() != null ? s.vwapDistancePct() : 0.0);

        boolean allowed = optionsBuyingAllowed(ctx.status(), bias, ctx.adx());
        TrendBrief.Permission permission = new TrendBrief.Permission(
            allowed, allowed ? bias.optionType().name() : "none");

        return new TrendBrief(trend, structure, volatility, keyLevels, permission);
    }

    /** The 15-minute gate rule, shared with the trend analyzer. */
    public static boolean optionsBuyingAllowed(ContextStatus status, Bias bias, Double adx) {
        if (status != ContextStatus.COMPLETE) return false;
        if (bias == null || !bias.isDirectional()) return false;
        return adx == null || adx >= MIN_TRENDING_ADX;
    }

    public static String strengthLabel(Double adx) {
        if (adx == null || adx.isNaN()) return "unknown";
        if (adx >= STRONG_ADX)       return "strong";
        if (adx >= MIN_TRENDING_ADX) return "moderate";
        return "weak";
    }

    static String direction(Bias bias) {
        return switch (bias) {
            case BULLISH -> "bullish";
            case BEARISH -> "bearish";
            case NEUTRAL -> "sideways";
        };
    }

    static String emaStack(Double ema9, Double ema21) {
        if (ema9 == null || ema21 == null) return "mixed";
        if (ema9 > ema21) return "bullish";
        if (ema9 < ema21) return "bearish";
        return "mixed";
    }

    static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
