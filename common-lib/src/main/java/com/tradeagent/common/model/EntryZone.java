package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Price band around the trigger close inside which an entry is still considered valid. */
public record EntryZone(
    @JsonProperty("from") double from,
    @JsonProperty("to") double to
) {
    public static EntryZone around(double close) {
        return new EntryZone(round2(close * 0.98), round2(close * 1.02));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
