package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Secondary 1-minute facts for {@link TriggerContract}; all optional. */
public record TriggerSignals(
    @JsonProperty("atrSpike") Boolean atrSpike,
    @JsonProperty("rejectionWick") Boolean rejectionWick,
    @JsonProperty("rrEstimate") Double rrEstimate
) {
    public static TriggerSignals none() {
        return new TriggerSignals(null, null, null);
    }
}
