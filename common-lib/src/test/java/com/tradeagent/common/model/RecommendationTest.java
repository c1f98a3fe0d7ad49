package com.tradeagent.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecommendationTest {

    @Nested
    @DisplayName("Decision.fromConfidence()")
    class BandTests {

        @Test
        @DisplayName("0.7 → ENTER, 0.6 → WAIT, 0.49 → NO_TRADE")
        void bands() {
            assertEquals(Decision.ENTER, Decision.fromConfidence(0.7));
            assertEquals(Decision.WAIT, Decision.fromConfidence(0.6));
            assertEquals(Decision.WAIT, Decision.fromConfidence(0.5));
            assertEquals(Decision.NO_TRADE, Decision.fromConfidence(0.49));
        }
    }

    @Nested
    @DisplayName("Decision.parse() / capConfidence()")
    class StatedDecisionTests {

        @Test
        @DisplayName("model spellings of each verdict")
        void parse() {
            assertEquals(Decision.ENTER, Decision.parse("enter"));
            assertEquals(Decision.WAIT, Decision.parse(" WAIT "));
            assertEquals(Decision.NO_TRADE, Decision.parse("noTrade"));
            assertEquals(Decision.NO_TRADE, Decision.parse("no_trade"));
            assertEquals(Decision.NO_TRADE, Decision.parse("NO TRADE"));
            assertNull(Decision.parse("buy"));
            assertNull(Decision.parse(null));
        }

        @Test
        @DisplayName("cap keeps confidence inside the stated band or below it")
        void cap() {
            assertEquals(0.85, Decision.ENTER.capConfidence(0.85));
            assertEquals(Decision.WAIT, Decision.fromConfidence(Decision.WAIT.capConfidence(0.85)));
            assertEquals(Decision.NO_TRADE, Decision.fromConfidence(Decision.NO_TRADE.capConfidence(0.85)));
            assertEquals(0.3, Decision.WAIT.capConfidence(0.3));
            assertEquals(0.3, Decision.NO_TRADE.capConfidence(0.3));
        }
    }

    @Nested
    @DisplayName("consistency enforced by the constructor")
    class ConsistencyTests {

        @Test
        @DisplayName("ENTER with confidence below 0.7 is rejected")
        void enterBelowBand() {
            assertThrows(IllegalArgumentException.class, () ->
                new Recommendation(Decision.ENTER, OptionType.CE, 25000.0, 100.0, 92.0,
                    List.of(125.0), 0.65, "x", List.of()));
        }

        @Test
        @DisplayName("ENTER without a strike is rejected")
        void enterWithoutStrike() {
            assertThrows(IllegalArgumentException.class, () ->
                new Recommendation(Decision.ENTER, OptionType.CE, null, 100.0, 92.0,
                    List.of(125.0), 0.8, "x", List.of()));
        }

        @Test
        @DisplayName("of() derives the decision from confidence")
        void ofDerivesDecision() {
            Recommendation r = Recommendation.of(OptionType.PE, 24900.0, 80.0, 73.6,
                List.of(100.0, 116.0), 0.82, "aligned", List.of("15m", "5m", "options", "1m"));
            assertEquals(Decision.ENTER, r.decision());
            assertEquals(4, r.gatesPassed().size());
        }

        @Test
        @DisplayName("of() clamps confidence into [0, 1]")
        void ofClamps() {
            assertEquals(1.0, Recommendation.of(OptionType.CE, 1.0, null, null, null, 1.7, "", null).confidence());
            assertEquals(0.0, Recommendation.of(null, null, null, null, null, -0.2, "", null).confidence());
        }

        @Test
        @DisplayName("noTrade() → NO_TRADE with confidence 0.0")
        void noTrade() {
            Recommendation r = Recommendation.noTrade("Gate failed: 15m: trade not allowed", List.of());
            assertEquals(Decision.NO_TRADE, r.decision());
            assertEquals(0.0, r.confidence());
            assertTrue(r.isNoTrade());
            assertTrue(r.gatesPassed().isEmpty());
        }
    }

    @Nested
    @DisplayName("Moneyness.classify()")
    class MoneynessTests {

        @Test
        @DisplayName("calls below ATM and puts above ATM are ITM")
        void classify() {
            assertEquals(Moneyness.ATM, Moneyness.classify(25000, 25000, OptionType.CE));
            assertEquals(Moneyness.ITM, Moneyness.classify(24950, 25000, OptionType.CE));
            assertEquals(Moneyness.OTM, Moneyness.classify(25050, 25000, OptionType.CE));
            assertEquals(Moneyness.ITM, Moneyness.classify(25050, 25000, OptionType.PE));
            assertEquals(Moneyness.OTM, Moneyness.classify(24950, 25000, OptionType.PE));
        }
    }
}
