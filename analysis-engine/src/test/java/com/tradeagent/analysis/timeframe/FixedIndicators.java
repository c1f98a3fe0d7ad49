package com.tradeagent.analysis.timeframe;

import com.tradeagent.analysis.indicator.IndicatorCalculator;
import com.tradeagent.common.model.Candle;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Indicator stub returning preset values regardless of input. Unset values are {@code null}. */
public class FixedIndicators implements IndicatorCalculator {

    private final Map<Integer, Double> ema = new HashMap<>();
    private Double rsi;
    private Double atr;
    private Double adx;
    private Double diDiff;
    private Double vwap;

    public FixedIndicators ema(int period, double value) {
        ema.put(period, value);
        return this;
    }

    public FixedIndicators rsi(double value) {
        this.rsi = value;
        return this;
    }

    public FixedIndicators atr(double value) {
        this.atr = value;
        return this;
    }

    public FixedIndicators adx(double value, double diDiff) {
        this.adx = value;
        this.diDiff = diDiff;
        return this;
    }

    public FixedIndicators vwap(double value) {
        this.vwap = value;
        return this;
    }

    @Override
    public Double ema(List<Double> closes, int period) {
        return ema.get(period);
    }

    @Override
    public Double rsi(List<Double> closes, int period) {
        return rsi;
    }

    @Override
    public Double atr(List<Candle> candles, int period) {
        return atr;
    }

    @Override
    public Double adx(List<Candle> candles, int period) {
        return adx;
    }

    @Override
    public Double diDiff(List<Candle> candles, int period) {
        return diDiff;
    }

    @Override
    public Double vwap(List<Candle> candles) {
        return vwap;
    }
}
