package com.tradeagent.orchestrator.pipeline;

import com.tradeagent.analysis.timeframe.SetupAnalysis;
import com.tradeagent.analysis.timeframe.TrendAnalysis;
import com.tradeagent.analysis.timeframe.TriggerAnalysis;
import com.tradeagent.common.contract.MarketConditions;
import com.tradeagent.common.contract.MarketConditionsContract;
import com.tradeagent.common.contract.OptionStrikeContract;
import com.tradeagent.common.contract.SetupContract;
import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.contract.TrendContract;
import com.tradeagent.common.contract.TriggerContract;
import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.TrendContext;
import com.tradeagent.common.session.SessionPhase;
import com.tradeagent.common.session.TradingSessionClassifier;
import com.tradeagent.common.session.VolatilityRegime;
import com.tradeagent.orchestrator.config.PipelineSettings;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Turns the gate-passing analyses into the {@link StructuredBrief} handed to the strategist.
 */
public class BriefAssembler {

    private final PipelineSettings settings;
    private final Clock clock;

    public BriefAssembler(PipelineSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public StructuredBrief assemble(String symbol, TrendAnalysis trend, SetupAnalysis setup, TriggerAnalysis trigger,
                                    List<OptionCandidate> candidates, LocalDate expiry) {
        return new StructuredBrief(
            symbol,
            TrendContract.build(trend.context(), trend.signals()),
            SetupContract.build(setup.context(), setup.signals()),
            TriggerContract.build(trigger.context(), trigger.signals()),
            OptionStrikeContract.build(candidates),
            marketConditions(trend.context(), expiry));
    }

    MarketConditions marketConditions(TrendContext trend, LocalDate expiry) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, TradingSessionClassifier.IST);
        SessionPhase phase = TradingSessionClassifier.classify(now);
        VolatilityRegime regime = VolatilityRegime.fromAtr(trend.atr(), trend.latestClose());
        boolean sideways = trend.bias() == Bias.NEUTRAL;
        boolean expiryDay = today.equals(expiry);
        boolean majorEvent = settings.eventDates().contains(today);
        return MarketConditionsContract.build(phase, regime, sideways, expiryDay, majorEvent);
    }
}
