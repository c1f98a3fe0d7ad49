package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.contract.SetupSignals;
import com.tradeagent.common.model.SetupContext;

public record SetupAnalysis(SetupContext context, SetupSignals signals) {

    public static SetupAnalysis failed(String error) {
        return new SetupAnalysis(SetupContext.error(error), SetupSignals.none());
    }
}
