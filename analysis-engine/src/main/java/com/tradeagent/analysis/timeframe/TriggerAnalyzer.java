package com.tradeagent.analysis.timeframe;

import com.tradeagent.analysis.indicator.IndicatorCalculator;
import com.tradeagent.common.contract.TriggerSignals;
import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.ContextStatus;
import com.tradeagent.common.model.EntrySignal;
import com.tradeagent.common.model.EntryZone;
import com.tradeagent.common.model.Timeframe;
import com.tradeagent.common.model.TriggerContext;
import com.tradeagent.common.model.TriggerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 1-minute entry trigger analyzer.
 *
 * <p>The trigger is {@link EntrySignal#CONFIRMED} when a trigger pattern fired and the last
 * candle closed in the bias direction; {@link EntrySignal#FORMING} when only a strong close
 * in the bias direction is present.
 *
 * <h3>Trigger patterns (first match wins)</h3>
 * <pre>
 *   RANGE_BREAK     close beyond the extreme of the previous 10 candles
 *   VWAP_RECLAIM    previous close on the wrong side of VWAP, last close on the right side
 *   MOMENTUM_BURST  ≥ 2 consecutive strong closes and range expansion ≥ 50%
 * </pre>
 */
public class TriggerAnalyzer implements TimeframeAnalyzer<TriggerAnalysis> {

    private static final Logger log = LoggerFactory.getLogger(TriggerAnalyzer.class);

    static final int ATR_PERIOD = 14;
    static final int RANGE_WINDOW = 10;
    static final double BURST_EXPANSION_PCT = 50.0;
    static final double ATR_SPIKE_FACTOR = 1.5;
    static final double STRONG_BODY_RATIO = 0.5;

    private final IndicatorCalculator indicators;

    public TriggerAnalyzer(IndicatorCalculator indicators) {
        this.indicators = indicators;
    }

    @Override
    public Timeframe timeframe() {
        return Timeframe.ONE_MINUTE;
    }

    @Override
    public TriggerAnalysis analyze(List<Candle> candles, Bias higherTimeBias) {
        if (candles == null || candles.size() < 2) {
            log.info("[TriggerAnalyzer] Not enough 1m candles, context NO_DATA");
            return new TriggerAnalysis(TriggerContext.noData(), TriggerSignals.none());
        }
        Bias bias = higherTimeBias != null ? higherTimeBias : Bias.NEUTRAL;

        Candle last = CandleSeries.last(candles);
        Candle previous = candles.get(candles.size() - 2);
        List<Candle> window = CandleSeries.priorWindow(candles, RANGE_WINDOW);

        Double atr  = indicators.atr(candles, ATR_PERIOD);
        Double vwap = indicators.vwap(candles);

        double avgRange = CandleSeries.averageRange(window);
        double expansionPct = avgRange > 0 ? CandleSeries.round2((last.range() / avgRange - 1.0) * 100.0) : 0.0;
        int strongCloses = consecutiveStrongCloses(bias, candles);
        boolean structureHolds = bias == Bias.BEARISH
            ? last.high() < previous.high()
            : last.low() > previous.low();

        TriggerType type = triggerType(bias, last, previous, window, vwap, strongCloses, expansionPct);
        EntrySignal signal = entrySignal(bias, type, last, strongCloses);

        TriggerContext ctx = new TriggerContext(ContextStatus.COMPLETE, signal, type, expansionPct,
            strongCloses, structureHolds, EntryZone.around(last.close()), atr, vwap, last.close(), null);

        log.info("[TriggerAnalyzer] bias={} trigger={} signal={} expansionPct={} strongCloses={}",
            bias, type, signal, expansionPct, strongCloses);

        return new TriggerAnalysis(ctx, signals(bias, candles, last, atr));
    }

    static TriggerType triggerType(Bias bias, Candle last, Candle previous, List<Candle> window,
                                   Double vwap, int strongCloses, double expansionPct) {
        if (!bias.isDirectional()) return TriggerType.NONE;
        boolean bull = bias == Bias.BULLISH;

        if (!window.isEmpty()) {
            if (bull && last.close() > CandleSeries.highestHigh(window)) return TriggerType.RANGE_BREAK;
            if (!bull && last.close() < CandleSeries.lowestLow(window))  return TriggerType.RANGE_BREAK;
        }
        if (vwap != null) {
            if (bull && previous.close() < vwap && last.close() > vwap)  return TriggerType.VWAP_RECLAIM;
            if (!bull && previous.close() > vwap && last.close() < vwap) return TriggerType.VWAP_RECLAIM;
        }
        if (strongCloses >= 2 && expansionPct >= BURST_EXPANSION_PCT) return TriggerType.MOMENTUM_BURST;
        return TriggerType.NONE;
    }

    static EntrySignal entrySignal(Bias bias, TriggerType type, Candle last, int strongCloses) {
        boolean closedWithBias = bias == Bias.BULLISH ? last.isBullish() : bias == Bias.BEARISH && last.isBearish();
        if (type != TriggerType.NONE && closedWithBias) return EntrySignal.CONFIRMED;
        if (strongCloses >= 1) return EntrySignal.FORMING;
        return EntrySignal.NOT_CONFIRMED;
    }

    /** Strong close: body at least half the range, in the bias direction. Counted from the end. */
    static int consecutiveStrongCloses(Bias bias, List<Candle> candles) {
        if (!bias.isDirectional()) return 0;
        int count = 0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            Candle c = candles.get(i);
            boolean direction = bias == Bias.BULLISH ? c.isBullish() : c.isBearish();
            boolean strongBody = c.range() > 0 && c.body() >= STRONG_BODY_RATIO * c.range();
            if (!direction || !strongBody) break;
            count++;
        }
        return count;
    }

    private static TriggerSignals signals(Bias bias, List<Candle> candles, Candle last, Double atr) {
        Boolean atrSpike = atr != null ? last.range() > ATR_SPIKE_FACTOR * atr : null;

        double upperWick = last.high() - Math.max(last.open(), last.close());
        double lowerWick = Math.min(last.open(), last.close()) - last.low();
        double adverseWick = bias == Bias.BEARISH ? lowerWick : upperWick;
        boolean rejectionWick = last.range() > 0 && adverseWick > STRONG_BODY_RATIO * last.range();

        Double rr = null;
        List<Candle> swing = candles.subList(Math.max(0, candles.size() - RANGE_WINDOW - 1), candles.size());
        if (atr != null && bias.isDirectional()) {
            double risk = bias == Bias.BULLISH
                ? last.close() - CandleSeries.lowestLow(swing)
                : CandleSeries.highestHigh(swing) - last.close();
            if (risk > 0) rr = CandleSeries.round2(2.0 * atr / risk);
        }
        return new TriggerSignals(atrSpike, rejectionWick, rr);
    }
}
