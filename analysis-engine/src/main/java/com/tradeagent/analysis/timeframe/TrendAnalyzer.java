package com.tradeagent.analysis.timeframe;

import com.tradeagent.analysis.indicator.IndicatorCalculator;
import com.tradeagent.common.contract.TrendContract;
import com.tradeagent.common.contract.TrendSignals;
import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.ContextStatus;
import com.tradeagent.common.model.Timeframe;
import com.tradeagent.common.model.TrendContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 15-minute trend analyzer.
 *
 * <ul>
 *   <li>Bias: EMA(9) vs EMA(21)</li>
 *   <li>Strength: ADX(14) ladder from {@link TrendContract#strengthLabel}</li>
 *   <li>Volatility: latest ATR(14) against the ATR one window earlier</li>
 *   <li>Gate: {@link TrendContract#optionsBuyingAllowed}</li>
 * </ul>
 * Structure and key-level facts are returned separately as {@link TrendSignals}.
 */
public class TrendAnalyzer implements TimeframeAnalyzer<TrendAnalysis> {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    static final int FAST_EMA = 9;
    static final int SLOW_EMA = 21;
    static final int ADX_PERIOD = 14;
    static final int ATR_PERIOD = 14;
    static final int STRUCTURE_WINDOW = 10;
    static final int BOS_LOOKBACK = 20;
    static final double VWAP_BAND_PCT = 0.1;

    private final IndicatorCalculator indicators;

    public TrendAnalyzer(IndicatorCalculator indicators) {
        this.indicators = indicators;
    }

    @Override
    public Timeframe timeframe() {
        return Timeframe.FIFTEEN_MINUTE;
    }

    @Override
    public TrendAnalysis analyze(List<Candle> candles, Bias higherTimeBias) {
        if (candles == null || candles.isEmpty()) {
            log.info("[TrendAnalyzer] No 15m candles, context NO_DATA");
            return new TrendAnalysis(TrendContext.noData(), TrendSignals.none());
        }

        List<Double> closes = CandleSeries.closes(candles);
        double close = CandleSeries.last(candles).close();

        Double ema9   = indicators.ema(closes, FAST_EMA);
        Double ema21  = indicators.ema(closes, SLOW_EMA);
        Double adx    = indicators.adx(candles, ADX_PERIOD);
        Double diDiff = indicators.diDiff(candles, ADX_PERIOD);
        Double atr    = indicators.atr(candles, ATR_PERIOD);
        Double vwap   = indicators.vwap(candles);

        Bias bias = Bias.fromEmaCross(ema9, ema21);
        String strength = TrendContract.strengthLabel(adx);
        String atrTrend = atrTrend(atr, indicators.atr(CandleSeries.dropLast(candles, ATR_PERIOD), ATR_PERIOD));
        boolean tradeAllowed = TrendContract.optionsBuyingAllowed(ContextStatus.COMPLETE, bias, adx);

        TrendContext ctx = new TrendContext(ContextStatus.COMPLETE, bias, strength, atrTrend,
            ema9, ema21, adx, diDiff, atr, vwap, close, tradeAllowed, null);

        log.info("[TrendAnalyzer] bias={} strength={} adx={} ema9={} ema21={} tradeAllowed={}",
            bias, strength, adx, ema9, ema21, tradeAllowed);

        return new TrendAnalysis(ctx, signals(candles, close, atr, vwap, atrTrend));
    }

    private TrendSignals signals(List<Candle> candles, double close, Double atr, Double vwap, String atrTrend) {
        Candle last = CandleSeries.last(candles);
        String rangeState = atr != null && last.range() > atr ? "expansion" : "compression";

        String vwapPosition = null;
        Double vwapDistance = null;
        if (vwap != null && vwap > 0) {
            double distancePct = (close - vwap) / vwap * 100.0;
            vwapDistance = CandleSeries.round2(distancePct);
            if (distancePct > VWAP_BAND_PCT)       vwapPosition = "above";
            else if (distancePct < -VWAP_BAND_PCT) vwapPosition = "below";
            else                                   vwapPosition = "inside";
        }

        BreakOfStructure bos = lastBreakOfStructure(candles);
        return new TrendSignals(marketStructure(candles), bos.direction(), bos.age(),
            atrTrend, rangeState, vwapPosition, vwapDistance);
    }

    static String atrTrend(Double current, Double earlier) {
        if (current == null || earlier == null || earlier == 0) return "stable";
        double ratio = current / earlier;
        if (ratio > 1.1) return "expanding";
        if (ratio < 0.9) return "contracting";
        return "stable";
    }

    /** Compares the last window of highs/lows with the one before it. */
    static String marketStructure(List<Candle> candles) {
        if (candles.size() < 2 * STRUCTURE_WINDOW) return "range";
        int n = candles.size();
        List<Candle> recent = candles.subList(n - STRUCTURE_WINDOW, n);
        List<Candle> before = candles.subList(n - 2 * STRUCTURE_WINDOW, n - STRUCTURE_WINDOW);

        boolean higherHigh = CandleSeries.highestHigh(recent) > CandleSeries.highestHigh(before);
        boolean higherLow  = CandleSeries.lowestLow(recent)   > CandleSeries.lowestLow(before);
        if (higherHigh && higherLow)   return "higher_highs";
        if (!higherHigh && !higherLow) return "lower_lows";
        return "range";
    }

    record BreakOfStructure(String direction, int age) {}

    /**
     * Most recent candle whose close broke the range of the {@link #BOS_LOOKBACK} candles
     * before it; age is counted in candles from the end of the series.
     */
    static BreakOfStructure lastBreakOfStructure(List<Candle> candles) {
        for (int i = candles.size() - 1; i >= BOS_LOOKBACK; i--) {
            List<Candle> window = candles.subList(i - BOS_LOOKBACK, i);
            double close = candles.get(i).close();
            int age = candles.size() - 1 - i;
            if (close > CandleSeries.highestHigh(window)) return new BreakOfStructure("bullish", age);
            if (close < CandleSeries.lowestLow(window))   return new BreakOfStructure("bearish", age);
        }
        return new BreakOfStructure("none", 0);
    }
}
