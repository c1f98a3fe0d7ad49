package com.tradeagent.analysis.timeframe;

import com.tradeagent.analysis.indicator.IndicatorCalculator;
import com.tradeagent.common.contract.SetupSignals;
import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.ContextStatus;
import com.tradeagent.common.model.SetupContext;
import com.tradeagent.common.model.SetupType;
import com.tradeagent.common.model.Timeframe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 5-minute setup analyzer, evaluated in the direction of the 15-minute bias.
 *
 * <h3>Setup type (first match wins)</h3>
 * <pre>
 *   BREAKOUT            close beyond the extreme of the previous 10 candles
 *   PULLBACK            close within 0.2% of EMA(9), momentum aligned
 *   TREND_CONTINUATION  momentum aligned
 *   NONE                otherwise
 * </pre>
 *
 * <h3>Invalidations</h3>
 * <ul>
 *   <li>{@code weak_close}: last candle closed against the bias</li>
 *   <li>{@code failed_retest}: last close on the wrong side of VWAP</li>
 * </ul>
 */
public class SetupAnalyzer implements TimeframeAnalyzer<SetupAnalysis> {

    private static final Logger log = LoggerFactory.getLogger(SetupAnalyzer.class);

    static final int EMA_PERIOD = 9;
    static final int RSI_PERIOD = 14;
    static final int BREAKOUT_WINDOW = 10;
    static final int BEHAVIOR_WINDOW = 5;
    static final double PULLBACK_BAND = 0.002;

    private final IndicatorCalculator indicators;

    public SetupAnalyzer(IndicatorCalculator indicators) {
        this.indicators = indicators;
    }

    @Override
    public Timeframe timeframe() {
        return Timeframe.FIVE_MINUTE;
    }

    @Override
    public SetupAnalysis analyze(List<Candle> candles, Bias higherTimeBias) {
        if (candles == null || candles.isEmpty()) {
            log.info("[SetupAnalyzer] No 5m candles, context NO_DATA");
            return new SetupAnalysis(SetupContext.noData(), SetupSignals.none());
        }
        Bias bias = higherTimeBias != null ? higherTimeBias : Bias.NEUTRAL;

        List<Double> closes = CandleSeries.closes(candles);
        Candle last = CandleSeries.last(candles);
        double close = last.close();

        Double ema9 = indicators.ema(closes, EMA_PERIOD);
        Double rsi  = indicators.rsi(closes, RSI_PERIOD);
        Double vwap = indicators.vwap(candles);

        boolean aligned = momentumAligned(bias, close, ema9);
        SetupType setupType = setupType(bias, candles, close, ema9, aligned);
        List<String> invalidations = invalidations(bias, last, vwap);
        boolean proceed = setupType != SetupType.NONE && aligned && invalidations.isEmpty();

        SetupContext ctx = new SetupContext(ContextStatus.COMPLETE, bias, setupType, aligned, invalidations,
            ema9, rsi, vwap, close, proceed, null);

        log.info("[SetupAnalyzer] bias={} setup={} aligned={} invalidations={} proceedToEntry={}",
            bias, setupType, aligned, invalidations, proceed);

        return new SetupAnalysis(ctx, signals(bias, candles, closes, rsi, close, vwap));
    }

    static boolean momentumAligned(Bias bias, double close, Double ema9) {
        if (ema9 == null) return false;
        return switch (bias) {
            case BULLISH -> close >= ema9 * (1 - PULLBACK_BAND);
            case BEARISH -> close <= ema9 * (1 + PULLBACK_BAND);
            case NEUTRAL -> false;
        };
    }

    static SetupType setupType(Bias bias, List<Candle> candles, double close, Double ema9, boolean aligned) {
        if (!bias.isDirectional()) return SetupType.NONE;

        List<Candle> window = CandleSeries.priorWindow(candles, BREAKOUT_WINDOW);
        if (!window.isEmpty()) {
            if (bias == Bias.BULLISH && close > CandleSeries.highestHigh(window)) return SetupType.BREAKOUT;
            if (bias == Bias.BEARISH && close < CandleSeries.lowestLow(window))   return SetupType.BREAKOUT;
        }
        if (!aligned) return SetupType.NONE;
        if (ema9 != null && Math.abs(close - ema9) / ema9 <= PULLBACK_BAND) return SetupType.PULLBACK;
        return SetupType.TREND_CONTINUATION;
    }

    static List<String> invalidations(Bias bias, Candle last, Double vwap) {
        List<String> out = new ArrayList<>();
        if ((bias == Bias.BULLISH && last.isBearish()) || (bias == Bias.BEARISH && last.isBullish())) {
            out.add(SetupContext.WEAK_CLOSE);
        }
        if (vwap != null) {
            if ((bias == Bias.BULLISH && last.close() < vwap) || (bias == Bias.BEARISH && last.close() > vwap)) {
                out.add(SetupContext.FAILED_RETEST);
            }
        }
        return out;
    }

    private SetupSignals signals(Bias bias, List<Candle> candles, List<Double> closes,
                                 Double rsi, double close, Double vwap) {
        Double earlierRsi = closes.size() > 3
            ? indicators.rsi(closes.subList(0, closes.size() - 3), RSI_PERIOD)
            : null;
        String rsiTrend = null;
        if (rsi != null && earlierRsi != null) {
            double diff = rsi - earlierRsi;
            rsiTrend = diff > 2 ? "rising" : diff < -2 ? "falling" : "flat";
        }

        Double ema12 = indicators.ema(closes, 12);
        Double ema26 = indicators.ema(closes, 26);
        String macdState = null;
        if (ema12 != null && ema26 != null) {
            double macd = ema12 - ema26;
            macdState = macd > 0 ? "bullish" : macd < 0 ? "bearish" : "neutral";
        }

        String vwapRelation = null;
        if (vwap != null) {
            vwapRelation = close > vwap ? "above" : close < vwap ? "below" : "at";
        }

        return new SetupSignals(rsiTrend, macdState, priceBehavior(bias, candles), vwapRelation);
    }

    /** Counts candles closing in the bias direction over the last few bars. */
    static String priceBehavior(Bias bias, List<Candle> candles) {
        if (!bias.isDirectional() || candles.size() < BEHAVIOR_WINDOW) return null;
        List<Candle> recent = candles.subList(candles.size() - BEHAVIOR_WINDOW, candles.size());
        long withBias = recent.stream()
            .filter(c -> bias == Bias.BULLISH ? c.isBullish() : c.isBearish())
            .count();
        if (withBias >= 4) return "impulsive";
        if (withBias <= 1) return "corrective";
        return "choppy";
    }
}
