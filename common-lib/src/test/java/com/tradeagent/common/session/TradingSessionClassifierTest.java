package com.tradeagent.common.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class TradingSessionClassifierTest {

    private static Instant ist(int year, int month, int day, int hour, int minute) {
        return LocalDateTime.of(year, month, day, hour, minute)
            .atZone(TradingSessionClassifier.IST).toInstant();
    }

    @Test
    @DisplayName("weekday phases follow IST market hours")
    void weekdayPhases() {
        // 2024-06-12 is a Wednesday
        assertEquals(SessionPhase.CLOSED, TradingSessionClassifier.classify(ist(2024, 6, 12, 9, 0)));
        assertEquals(SessionPhase.OPEN, TradingSessionClassifier.classify(ist(2024, 6, 12, 9, 20)));
        assertEquals(SessionPhase.MID, TradingSessionClassifier.classify(ist(2024, 6, 12, 12, 0)));
        assertEquals(SessionPhase.CLOSE, TradingSessionClassifier.classify(ist(2024, 6, 12, 15, 0)));
        assertEquals(SessionPhase.CLOSED, TradingSessionClassifier.classify(ist(2024, 6, 12, 15, 45)));
    }

    @Test
    @DisplayName("weekend → CLOSED, last trading date rolls back to Friday")
    void weekend() {
        // 2024-06-15 is a Saturday
        Instant saturday = ist(2024, 6, 15, 11, 0);
        assertEquals(SessionPhase.CLOSED, TradingSessionClassifier.classify(saturday));
        assertEquals(LocalDate.of(2024, 6, 14), TradingSessionClassifier.lastTradingDate(saturday));
    }

    @Test
    @DisplayName("volatility regime from ATR% of price")
    void volatilityRegime() {
        assertEquals(VolatilityRegime.LOW, VolatilityRegime.fromAtr(20.0, 25000.0));
        assertEquals(VolatilityRegime.NORMAL, VolatilityRegime.fromAtr(50.0, 25000.0));
        assertEquals(VolatilityRegime.HIGH, VolatilityRegime.fromAtr(100.0, 25000.0));
        assertEquals(VolatilityRegime.UNKNOWN, VolatilityRegime.fromAtr(null, 25000.0));
    }
}
