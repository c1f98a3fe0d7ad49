package com.tradeagent.orchestrator.strategy;

import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.common.model.Recommendation;
import com.tradeagent.common.model.SetupContext;
import com.tradeagent.common.model.TrendContext;
import com.tradeagent.common.model.TriggerContext;

import java.util.List;

/**
 * Rule-based recommendation used when the model is disabled or fails.
 *
 * <pre>
 *   direction   CE on bullish bias, PE on bearish
 *   strike      best-scored candidate
 *   entry       low end of the 1m entry zone
 *   stop loss   1m close × 0.92
 *   targets     1m close × 1.25, × 1.45
 *   confidence  0.6 (WAIT)
 * </pre>
 */
public final class DeterministicRecommender {

    public static final double CONFIDENCE    = 0.6;
    static final double STOP_FACTOR          = 0.92;
    static final double FIRST_TARGET_FACTOR  = 1.25;
    static final double SECOND_TARGET_FACTOR = 1.45;

    private DeterministicRecommender() {}

    public static Recommendation recommend(TrendContext trend, SetupContext setup, TriggerContext trigger,
                                           List<OptionCandidate> candidates, List<String> gatesPassed) {
        OptionType direction = trend.bias().optionType();
        if (direction == null) {
            return Recommendation.noTrade("No directional bias on 15m", gatesPassed);
        }

        Double strike = candidates.isEmpty() ? null : candidates.get(0).strike();
        Double entry = trigger.entryZone() != null ? trigger.entryZone().from() : null;
        Double close = trigger.latestClose();
        Double stop = close != null ? round2(close * STOP_FACTOR) : null;
        List<Double> targets = close != null
            ? List.of(round2(close * FIRST_TARGET_FACTOR), round2(close * SECOND_TARGET_FACTOR))
            : List.of();

        String rationale = String.format("Deterministic analysis: %s trend (%s), %s setup, %s trigger",
            trend.bias().name().toLowerCase(), trend.strength(),
            setup.setupType().name().toLowerCase(), trigger.triggerType().name().toLowerCase());

        return Recommendation.of(direction, strike, entry, stop, targets, CONFIDENCE, rationale, gatesPassed);
    }

    static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
