package com.tradeagent.analysis.indicator;

import com.tradeagent.common.model.Candle;

import java.util.List;

/**
 * {@link IndicatorCalculator} backed by {@link TechnicalIndicators}; NaN becomes {@code null}.
 */
public class DefaultIndicatorCalculator implements IndicatorCalculator {

    @Override
    public Double ema(List<Double> closes, int period) {
        return finite(TechnicalIndicators.ema(closes, period));
    }

    @Override
    public Double rsi(List<Double> closes, int period) {
        return finite(TechnicalIndicators.rsi(closes, period));
    }

    @Override
    public Double atr(List<Candle> candles, int period) {
        return finite(TechnicalIndicators.atr(candles, period));
    }

    @Override
    public Double adx(List<Candle> candles, int period) {
        return finite(TechnicalIndicators.directionalIndex(candles, period).adx());
    }

    @Override
    public Double diDiff(List<Candle> candles, int period) {
        return finite(TechnicalIndicators.directionalIndex(candles, period).diDiff());
    }

    @Override
    public Double vwap(List<Candle> candles) {
        return finite(TechnicalIndicators.vwap(candles));
    }

    private static Double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }
}
