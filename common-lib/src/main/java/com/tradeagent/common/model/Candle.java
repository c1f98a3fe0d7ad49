package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One OHLCV bar as returned by the broker. Series of candles are always ordered oldest-first.
 */
public record Candle(
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("open") double open,
    @JsonProperty("high") double high,
    @JsonProperty("low") double low,
    @JsonProperty("close") double close,
    @JsonProperty("volume") long volume
) {
    public static Candle of(Instant timestamp, double open, double high, double low, double close, long volume) {
        return new Candle(timestamp, open, high, low, close, volume);
    }

    public double range() {
        return high - low;
    }

    public double body() {
        return Math.abs(close - open);
    }

    public boolean isBullish() {
        return close > open;
    }

    public boolean isBearish() {
        return close < open;
    }
}
