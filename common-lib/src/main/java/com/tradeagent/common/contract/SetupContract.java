package com.tradeagent.common.contract;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.SetupContext;
import com.tradeagent.common.model.SetupType;

/**
 * Turns a {@link SetupContext} into its {@link SetupBrief}.
 *
 * <p>Quality is a three-point score: RSI on the bias side of 50, momentum aligned with the
 * 15-minute bias, and no invalidations. 3 → high, 2 → medium, otherwise low.
 */
public final class SetupContract {

    private SetupContract() {}

    public static SetupBrief build(SetupContext ctx, SetupSignals signals) {
        SetupSignals s = signals != null ? signals : SetupSignals.none();

        String type = ctx.status().isComplete() && ctx.setupType() != null
            ? ctx.setupType().name().toLowerCase()
            : SetupType.NONE.name().toLowerCase();

        SetupBrief.Setup setup = new SetupBrief.Setup(type, quality(ctx));
        SetupBrief.Momentum momentum = new SetupBrief.Momentum(
            ctx.rsi(),
            TrendContract.orDefault(s.rsiTrend(), "flat"),
            TrendContract.orDefault(s.macdState(), "neutral"),
            ctx.momentumAligned());

        return new SetupBrief(setup, momentum,
            TrendContract.orDefault(s.priceBehavior(), "unknown"),
            TrendContract.orDefault(s.vwapRelation(), "unknown"),
            ctx.invalidations(),
            ctx.gatePassed());
    }

    static String quality(SetupContext ctx) {
        if (!ctx.status().isComplete()) return "low";
        int score = 0;
        if (rsiSupportsBias(ctx.rsi(), ctx.bias())) score++;
        if (ctx.momentumAligned()) score++;
        if (ctx.invalidations().isEmpty()) score++;
        if (score >= 3) return "high";
        if (score == 2) return "medium";
        return "low";
    }

    static boolean rsiSupportsBias(Double rsi, Bias bias) {
        if (rsi == null) return false;
        return switch (bias) {
            case BULLISH -> rsi > 50;
            case BEARISH -> rsi < 50;
            case NEUTRAL -> false;
        };
    }
}
