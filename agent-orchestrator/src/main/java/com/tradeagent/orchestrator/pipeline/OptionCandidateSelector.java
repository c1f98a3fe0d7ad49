package com.tradeagent.orchestrator.pipeline;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Moneyness;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.OptionQuote;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.common.scoring.StrikeScorer;
import com.tradeagent.orchestrator.config.PipelineSettings;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Filters, scores and ranks the chain for the trend direction.
 *
 * <p>Kept: quotes of the bias's option type at the ATM strike or the first strike OTM, with a
 * two-sided quote and a spread within {@link PipelineSettings#maxSpreadPct()}. Survivors are
 * scored by {@link StrikeScorer}, sorted best first and cut to
 * {@link PipelineSettings#maxCandidates()}.
 */
public class OptionCandidateSelector {

    private final PipelineSettings settings;

    public OptionCandidateSelector(PipelineSettings settings) {
        this.settings = settings;
    }

    public List<OptionCandidate> select(OptionChain chain, Bias bias) {
        OptionType type = bias != null ? bias.optionType() : null;
        if (type == null || chain == null || chain.isEmpty()) return List.of();

        TreeSet<Double> strikes = new TreeSet<>();
        chain.quotes().stream()
            .filter(q -> q.optionType() == type)
            .forEach(q -> strikes.add(q.strike()));
        if (strikes.isEmpty()) return List.of();

        double atm = atmStrike(strikes, chain.spotPrice());
        Set<Double> window = window(strikes, atm, type);

        return chain.quotes().stream()
            .filter(q -> q.optionType() == type)
            .filter(q -> window.contains(q.strike()))
            .filter(OptionQuote::hasTwoSidedQuote)
            .filter(q -> q.spreadPct() <= settings.maxSpreadPct())
            .map(q -> OptionCandidate.from(q, Moneyness.classify(q.strike(), atm, type)))
            .map(c -> c.withScore(StrikeScorer.score(c)))
            .sorted(Comparator.comparingDouble(OptionCandidate::score).reversed()
                .thenComparingDouble(OptionCandidate::strike))
            .limit(Math.max(0, settings.maxCandidates()))
            .toList();
    }

    static double atmStrike(TreeSet<Double> strikes, double spot) {
        Double floor = strikes.floor(spot);
        Double ceiling = strikes.ceiling(spot);
        if (floor == null) return ceiling;
        if (ceiling == null) return floor;
        return (spot - floor) <= (ceiling - spot) ? floor : ceiling;
    }

    /** ATM plus the first strike out of the money: above for calls, below for puts. */
    static Set<Double> window(TreeSet<Double> strikes, double atm, OptionType type) {
        Set<Double> window = new TreeSet<>();
        window.add(atm);
        Double otm = type == OptionType.CE ? strikes.higher(atm) : strikes.lower(atm);
        if (otm != null) window.add(otm);
        return window;
    }
}
