package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.Timeframe;

import java.util.List;

/**
 * Builds the raw context of one timeframe from its candle series.
 *
 * @param <A> analysis type: the context plus the secondary signals for its brief
 */
public interface TimeframeAnalyzer<A> {

    Timeframe timeframe();

    /**
     * @param candles        series ordered oldest-first; may be empty, never null
     * @param higherTimeBias bias of the 15-minute trend ({@link Bias#NEUTRAL} for the 15m analyzer itself)
     */
    A analyze(List<Candle> candles, Bias higherTimeBias);
}
