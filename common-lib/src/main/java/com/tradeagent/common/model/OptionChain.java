package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Option chain of one underlying for its nearest expiry.
 */
public record OptionChain(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("spotPrice") double spotPrice,
    @JsonProperty("expiries") List<LocalDate> expiries,
    @JsonProperty("expiry") LocalDate expiry,
    @JsonProperty("quotes") List<OptionQuote> quotes
) {
    public OptionChain {
        expiries = expiries == null ? List.of() : List.copyOf(expiries);
        quotes = quotes == null ? List.of() : List.copyOf(quotes);
    }

    public boolean isEmpty() {
        return quotes.isEmpty();
    }
}
