package com.tradeagent.orchestrator.strategy;

import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.Recommendation;

import java.util.List;

/**
 * Adjudicates a gate-passing run. Implementations never throw: on any failure they return
 * {@code fallback}.
 */
public interface RecommendationAdvisor {

    Recommendation advise(String symbol, StructuredBrief brief, List<OptionCandidate> candidates,
                          Recommendation fallback);
}
