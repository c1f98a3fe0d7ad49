package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 1-minute trigger context. Its gate is an {@link EntrySignal#CONFIRMED} entry signal.
 */
public record TriggerContext(
    @JsonProperty("status") ContextStatus status,
    @JsonProperty("entrySignal") EntrySignal entrySignal,
    @JsonProperty("triggerType") TriggerType triggerType,
    @JsonProperty("rangeExpansionPct") double rangeExpansionPct,
    @JsonProperty("consecutiveStrongCloses") int consecutiveStrongCloses,
    @JsonProperty("higherLow") boolean higherLow,
    @JsonProperty("entryZone") EntryZone entryZone,
    @JsonProperty("atr") Double atr,
    @JsonProperty("vwap") Double vwap,
    @JsonProperty("latestClose") Double latestClose,
    @JsonProperty("error") String error
) implements TimeframeContext {

    public static TriggerContext noData() {
        return new TriggerContext(ContextStatus.NO_DATA, EntrySignal.NOT_CONFIRMED, TriggerType.NONE,
            0.0, 0, false, null, null, null, null, null);
    }

    public static TriggerContext error(String message) {
        return new TriggerContext(ContextStatus.ERROR, EntrySignal.NOT_CONFIRMED, TriggerType.NONE,
            0.0, 0, false, null, null, null, null, message);
    }

    @Override
    @JsonProperty("timeframe")
    public Timeframe timeframe() {
        return Timeframe.ONE_MINUTE;
    }

    @Override
    public boolean gatePassed() {
        return status.isComplete() && entrySignal == EntrySignal.CONFIRMED;
    }
}
