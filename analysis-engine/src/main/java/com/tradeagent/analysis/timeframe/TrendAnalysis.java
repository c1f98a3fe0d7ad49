package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.contract.TrendSignals;
import com.tradeagent.common.model.TrendContext;

public record TrendAnalysis(TrendContext context, TrendSignals signals) {

    public static TrendAnalysis failed(String error) {
        return new TrendAnalysis(TrendContext.error(error), TrendSignals.none());
    }
}
