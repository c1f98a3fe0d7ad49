package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 5-minute setup context, built against the bias of the 15-minute trend (carried in
 * {@code bias}).
 * Its gate is {@link #proceedToEntry()}.
 */
public record SetupContext(
    @JsonProperty("status") ContextStatus status,
    @JsonProperty("bias") Bias bias,
    @JsonProperty("setupType") SetupType setupType,
    @JsonProperty("momentumAligned") boolean momentumAligned,
    @JsonProperty("invalidations") List<String> invalidations,
    @JsonProperty("ema9") Double ema9,
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("vwap") Double vwap,
    @JsonProperty("latestClose") Double latestClose,
    @JsonProperty("proceedToEntry") boolean proceedToEntry,
    @JsonProperty("error") String error
) implements TimeframeContext {

    public static final String WEAK_CLOSE = "weak_close";
    public static final String FAILED_RETEST = "failed_retest";
    public static final String NO_DATA = "no_data";

    public SetupContext {
        bias = bias == null ? Bias.NEUTRAL : bias;
        invalidations = invalidations == null ? List.of() : List.copyOf(invalidations);
    }

    public static SetupContext noData() {
        return new SetupContext(ContextStatus.NO_DATA, Bias.NEUTRAL, SetupType.NONE, false, List.of(NO_DATA),
            null, null, null, null, false, null);
    }

    public static SetupContext error(String message) {
        return new SetupContext(ContextStatus.ERROR, Bias.NEUTRAL, SetupType.NONE, false, List.of(),
            null, null, null, null, false, message);
    }

    @Override
    @JsonProperty("timeframe")
    public Timeframe timeframe() {
        return Timeframe.FIVE_MINUTE;
    }

    @Override
    public boolean gatePassed() {
        return status.isComplete() && proceedToEntry;
    }
}
