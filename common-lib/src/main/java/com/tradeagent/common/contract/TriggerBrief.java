package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeagent.common.model.EntryZone;

/** LLM-safe view of the 1-minute context. */
public record TriggerBrief(
    @JsonProperty("trigger") Trigger trigger,
    @JsonProperty("momentumIgnition") MomentumIgnition momentumIgnition,
    @JsonProperty("microStructure") MicroStructure microStructure,
    @JsonProperty("entryZone") EntryZone entryZone,
    @JsonProperty("risk") Risk risk
) {

    public record Trigger(
        @JsonProperty("status") String status,   // confirmed / forming / none
        @JsonProperty("type") String type
    ) {}

    public record MomentumIgnition(
        @JsonProperty("rangeExpansionPct") double rangeExpansionPct,
        @JsonProperty("consecutiveStrongCloses") int consecutiveStrongCloses,
        @JsonProperty("atrSpike") boolean atrSpike
    ) {}

    public record MicroStructure(
        @JsonProperty("higherLow") boolean higherLow,
        @JsonProperty("rejectionWick") boolean rejectionWick
    ) {}

    public record Risk(
        @JsonProperty("invalidPrice") Double invalidPrice,
        @JsonProperty("rrEstimate") Double rrEstimate
    ) {}
}
