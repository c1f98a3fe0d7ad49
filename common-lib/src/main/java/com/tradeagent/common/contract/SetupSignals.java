package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Secondary 5-minute facts for {@link SetupContract}; all optional. */
public record SetupSignals(
    @JsonProperty("rsiTrend") String rsiTrend,           // rising / falling / flat
    @JsonProperty("macdState") String macdState,         // bullish / bearish / neutral
    @JsonProperty("priceBehavior") String priceBehavior, // impulsive / corrective / choppy
    @JsonProperty("vwapRelation") String vwapRelation    // above / below / at
) {
    public static SetupSignals none() {
        return new SetupSignals(null, null, null, null);
    }
}
