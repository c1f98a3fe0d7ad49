package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The only payload the reasoning loop may show the model: transformed timeframe contexts,
 * surviving strikes and market-condition flags. Holds no price series and no candles.
 */
public record StructuredBrief(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("tf15m") TrendBrief tf15m,
    @JsonProperty("tf5m") SetupBrief tf5m,
    @JsonProperty("tf1m") TriggerBrief tf1m,
    @JsonProperty("optionStrikes") List<StrikeBrief> optionStrikes,
    @JsonProperty("marketConditions") MarketConditions marketConditions
) {
    public StructuredBrief {
        optionStrikes = optionStrikes == null ? List.of() : List.copyOf(optionStrikes);
    }

    public boolean optionsBuyingAllowed() {
        return tf15m != null && tf15m.permission() != null && tf15m.permission().optionsBuyingAllowed();
    }
}
