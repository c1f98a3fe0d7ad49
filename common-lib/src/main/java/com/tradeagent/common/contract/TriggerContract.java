package com.tradeagent.common.contract;

import com.tradeagent.common.model.TriggerContext;
import com.tradeagent.common.model.TriggerType;

/**
 * Turns a {@link TriggerContext} into its {@link TriggerBrief}. The invalidation price sits
 * 8% below the trigger close.
 */
public final class TriggerContract {

    static final double INVALIDATION_FACTOR = 0.92;

    private TriggerContract() {}

    public static TriggerBrief build(TriggerContext ctx, TriggerSignals signals) {
        TriggerSignals s = signals != null ? signals : TriggerSignals.none();

        TriggerBrief.Trigger trigger = new TriggerBrief.Trigger(
            statusLabel(ctx),
            (ctx.triggerType() != null ? ctx.triggerType() : TriggerType.NONE).name().toLowerCase());

        TriggerBrief.MomentumIgnition ignition = new TriggerBrief.MomentumIgnition(
            ctx.rangeExpansionPct(), ctx.consecutiveStrongCloses(), Boolean.TRUE.equals(s.atrSpike()));

        TriggerBrief.MicroStructure micro = new TriggerBrief.MicroStructure(
            ctx.higherLow(), Boolean.TRUE.equals(s.rejectionWick()));

        Double invalidPrice = ctx.latestClose() != null
            ? Math.round(ctx.latestClose() * INVALIDATION_FACTOR * 100.0) / 100.0
            : null;

        return new TriggerBrief(trigger, ignition, micro, ctx.entryZone(),
            new TriggerBrief.Risk(invalidPrice, s.rrEstimate()));
    }

    static String statusLabel(TriggerContext ctx) {
        if (!ctx.status().isComplete() || ctx.entrySignal() == null) return "none";
        return switch (ctx.entrySignal()) {
            case CONFIRMED     -> "confirmed";
            case FORMING       -> "forming";
            case NOT_CONFIRMED -> "none";
        };
    }
}
