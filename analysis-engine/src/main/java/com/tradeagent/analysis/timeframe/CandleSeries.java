package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.model.Candle;

import java.util.List;

/** Small helpers over oldest-first candle lists. */
final class CandleSeries {

    private CandleSeries() {}

    static List<Double> closes(List<Candle> candles) {
        return candles.stream().map(Candle::close).toList();
    }

    static Candle last(List<Candle> candles) {
        return candles.get(candles.size() - 1);
    }

    /** The {@code count} candles preceding the last one (fewer if the series is short). */
    static List<Candle> priorWindow(List<Candle> candles, int count) {
        int end = candles.size() - 1;
        int start = Math.max(0, end - count);
        return candles.subList(start, end);
    }

    /** Series without its last {@code count} candles. */
    static List<Candle> dropLast(List<Candle> candles, int count) {
        return candles.subList(0, Math.max(0, candles.size() - count));
    }

    static double highestHigh(List<Candle> window) {
        return window.stream().mapToDouble(Candle::high).max().orElse(Double.NaN);
    }

    static double lowestLow(List<Candle> window) {
        return window.stream().mapToDouble(Candle::low).min().orElse(Double.NaN);
    }

    static double averageRange(List<Candle> window) {
        return window.stream().mapToDouble(Candle::range).average().orElse(0.0);
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
