package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.contract.TriggerSignals;
import com.tradeagent.common.model.TriggerContext;

public record TriggerAnalysis(TriggerContext context, TriggerSignals signals) {

    public static TriggerAnalysis failed(String error) {
        return new TriggerAnalysis(TriggerContext.error(error), TriggerSignals.none());
    }
}
