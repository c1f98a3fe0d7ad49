package com.tradeagent.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terminal artifact of one pipeline run.
 *
 * <p>The canonical constructor rejects any combination where {@code decision} disagrees with
 * the confidence band of {@link Decision}, and any {@code ENTER} without a strike.
 */
public record Recommendation(
    @JsonProperty("decision") Decision decision,
    @JsonProperty("direction") OptionType direction,
    @JsonProperty("strike") Double strike,
    @JsonProperty("entry") Double entry,
    @JsonProperty("stopLoss") Double stopLoss,
    @JsonProperty("targets") List<Double> targets,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("rationale") String rationale,
    @JsonProperty("gatesPassed") List<String> gatesPassed
) {

    public Recommendation {
        if (decision == null) throw new IllegalArgumentException("decision is required");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        if (Decision.fromConfidence(confidence) != decision) {
            throw new IllegalArgumentException(
                "decision " + decision + " inconsistent with confidence " + confidence);
        }
        if (decision == Decision.ENTER && strike == null) {
            throw new IllegalArgumentException("ENTER requires a strike");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
        gatesPassed = gatesPassed == null ? List.of() : List.copyOf(gatesPassed);
    }

    /** Gate failure or explicit refusal. Confidence is always 0.0. */
    public static Recommendation noTrade(String rationale, List<String> gatesPassed) {
        return new Recommendation(Decision.NO_TRADE, null, null, null, null, List.of(),
            0.0, rationale, gatesPassed);
    }

    /** Builds a recommendation whose decision is derived from {@code confidence}. */
    public static Recommendation of(OptionType direction, Double strike, Double entry, Double stopLoss,
                                    List<Double> targets, double confidence, String rationale,
                                    List<String> gatesPassed) {
        double bounded = Math.max(0.0, Math.min(1.0, confidence));
        return new Recommendation(Decision.fromConfidence(bounded), direction, strike, entry, stopLoss,
            targets, bounded, rationale, gatesPassed);
    }

    public boolean isNoTrade() {
        return decision == Decision.NO_TRADE;
    }
}
