package com.tradeagent.orchestrator.pipeline;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Moneyness;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.OptionQuote;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.orchestrator.config.PipelineSettings;
import com.tradeagent.orchestrator.tool.RegistryMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.tradeagent.orchestrator.pipeline.PipelineFixtures.EXPIRY;
import static com.tradeagent.orchestrator.pipeline.PipelineFixtures.quote;
import static org.junit.jupiter.api.Assertions.*;

class OptionCandidateSelectorTest {

    private final OptionCandidateSelector selector = new OptionCandidateSelector(PipelineSettings.defaults());

    private static OptionChain chainAt(double spot, List<OptionQuote> quotes) {
        return new OptionChain("NIFTY", spot, List.of(EXPIRY), EXPIRY, quotes);
    }

    private static List<Double> strikes(List<OptionCandidate> candidates) {
        return candidates.stream().map(OptionCandidate::strike).toList();
    }

    @Test
    @DisplayName("bullish bias keeps ATM and the next call above, best score first")
    void bullishWindowAndRanking() {
        List<OptionCandidate> candidates = selector.select(PipelineFixtures.chain(), Bias.BULLISH);

        assertEquals(List.of(23550.0, 23500.0), strikes(candidates));
        assertEquals(Moneyness.OTM, candidates.get(0).moneyness());
        assertEquals(Moneyness.ATM, candidates.get(1).moneyness());
        assertTrue(candidates.stream().allMatch(c -> c.optionType() == OptionType.CE));
        assertEquals("building", candidates.get(0).oiTrend());
    }

    @Test
    @DisplayName("spot exactly between two strikes resolves ATM to the lower one")
    void atmTieGoesToFloor() {
        OptionChain chain = chainAt(23525.0, List.of(
            quote(23500, OptionType.CE, 150.0, 150.5, 0.50, 0.012, -8.0, null),
            quote(23550, OptionType.CE, 120.0, 120.5, 0.42, 0.012, -8.0, null),
            quote(23600, OptionType.CE, 95.0, 95.4, 0.33, 0.012, -7.0, null)));

        List<OptionCandidate> candidates = selector.select(chain, Bias.BULLISH);

        assertEquals(Set.of(23500.0, 23550.0), Set.copyOf(strikes(candidates)));
        assertTrue(candidates.stream()
            .anyMatch(c -> c.strike() == 23500.0 && c.moneyness() == Moneyness.ATM));
    }

    @Test
    @DisplayName("bearish bias walks below ATM on puts")
    void bearishWindow() {
        OptionChain chain = chainAt(23510.0, List.of(
            quote(23400, OptionType.PE, 80.0, 80.4, -0.30, 0.012, -7.0, null),
            quote(23450, OptionType.PE, 100.0, 100.4, -0.40, 0.012, -8.0, null),
            quote(23500, OptionType.PE, 130.0, 130.5, -0.48, 0.012, -8.0, null),
            quote(23550, OptionType.PE, 160.0, 160.6, -0.58, 0.012, -9.0, null),
            quote(23500, OptionType.CE, 150.0, 150.5, 0.52, 0.012, -8.0, null)));

        List<OptionCandidate> candidates = selector.select(chain, Bias.BEARISH);

        assertEquals(Set.of(23450.0, 23500.0), Set.copyOf(strikes(candidates)));
        assertTrue(candidates.stream().allMatch(c -> c.optionType() == OptionType.PE));
        assertTrue(candidates.stream()
            .anyMatch(c -> c.strike() == 23450.0 && c.moneyness() == Moneyness.OTM));
    }

    @Test
    @DisplayName("neutral bias or missing chain yields nothing")
    void noDirectionNoCandidates() {
        assertTrue(selector.select(PipelineFixtures.chain(), Bias.NEUTRAL).isEmpty());
        assertTrue(selector.select(null, Bias.BULLISH).isEmpty());
    }

    @Test
    @DisplayName("one-sided quotes and wide spreads are dropped")
    void illiquidQuotesDropped() {
        OptionChain chain = chainAt(23510.0, List.of(
            quote(23500, OptionType.CE, null, 150.5, 0.52, 0.012, -8.0, null),
            quote(23550, OptionType.CE, 110.0, 120.0, 0.42, 0.020, -8.0, null)));

        assertTrue(selector.select(chain, Bias.BULLISH).isEmpty());
        assertTrue(selector.select(PipelineFixtures.wideSpreadChain(), Bias.BULLISH).isEmpty());
    }

    @Test
    @DisplayName("result is cut to the configured candidate count")
    void maxCandidates() {
        OptionCandidateSelector single = new OptionCandidateSelector(
            new PipelineSettings("NIFTY", false, RegistryMode.ALERT, 1.0, 1, Set.of()));

        assertEquals(List.of(23550.0), strikes(single.select(PipelineFixtures.chain(), Bias.BULLISH)));
    }
}
