package com.tradeagent.analysis.indicator;

import com.tradeagent.common.model.Candle;

import java.util.List;

/**
 * Indicator arithmetic consumed by the timeframe analyzers. Every method is a pure function
 * of its input and returns {@code null} when the value cannot be computed.
 */
public interface IndicatorCalculator {

    Double ema(List<Double> closes, int period);

    Double rsi(List<Double> closes, int period);

    Double atr(List<Candle> candles, int period);

    Double adx(List<Candle> candles, int period);

    /** +DI minus −DI over the same window as {@link #adx}. */
    Double diDiff(List<Candle> candles, int period);

    Double vwap(List<Candle> candles);
}
