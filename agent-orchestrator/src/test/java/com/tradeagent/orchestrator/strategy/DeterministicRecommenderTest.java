package com.tradeagent.orchestrator.strategy;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Decision;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.common.model.Recommendation;
import com.tradeagent.common.model.TrendContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tradeagent.orchestrator.pipeline.PipelineFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DeterministicRecommenderTest {

    private static final List<String> GATES = List.of("15m", "5m", "options", "1m");

    @Test
    @DisplayName("bullish run: CE on the best strike with levels off the 1m close")
    void bullish() {
        Recommendation rec = DeterministicRecommender.recommend(
            bullishTrend().context(), pullbackSetup().context(), confirmedTrigger().context(), candidates(), GATES);

        assertEquals(Decision.WAIT, rec.decision());
        assertEquals(OptionType.CE, rec.direction());
        assertEquals(23550.0, rec.strike());
        assertEquals(99.96, rec.entry());
        assertEquals(93.84, rec.stopLoss());
        assertEquals(List.of(127.5, 147.9), rec.targets());
        assertEquals(DeterministicRecommender.CONFIDENCE, rec.confidence());
        assertEquals(GATES, rec.gatesPassed());
    }

    @Test
    @DisplayName("no strikes still yields levels, with no strike")
    void noCandidates() {
        Recommendation rec = DeterministicRecommender.recommend(
            bullishTrend().context(), pullbackSetup().context(), confirmedTrigger().context(), List.of(), GATES);

        assertNull(rec.strike());
        assertEquals(Decision.WAIT, rec.decision());
    }

    @Test
    @DisplayName("neutral 15m bias refuses to pick a side")
    void neutralBias() {
        TrendContext flat = flatTrendAnalyzer().analyze(risingCandles15m(), Bias.NEUTRAL).context();

        Recommendation rec = DeterministicRecommender.recommend(
            flat, pullbackSetup().context(), confirmedTrigger().context(), candidates(), List.of());

        assertTrue(rec.isNoTrade());
        assertEquals("No directional bias on 15m", rec.rationale());
    }
}
