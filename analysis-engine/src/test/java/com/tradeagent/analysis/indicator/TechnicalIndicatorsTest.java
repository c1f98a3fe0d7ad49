package com.tradeagent.analysis.indicator;

import com.tradeagent.common.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    private static final Instant T0 = Instant.parse("2024-06-12T04:00:00Z"); // 09:30 IST

    private static List<Candle> flatCandles(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Candle.of(T0.plusSeconds(60L * i), 10.0, 11.0, 9.0, 10.0, 0));
        }
        return out;
    }

    private static List<Candle> risingCandles(int n) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double mid = 100.0 + i;
            out.add(Candle.of(T0.plusSeconds(60L * i), mid - 0.5, mid + 1.0, mid - 1.0, mid + 0.5, 0));
        }
        return out;
    }

    @Nested
    @DisplayName("moving averages")
    class MovingAverageTests {

        @Test
        @DisplayName("SMA uses the most recent values")
        void smaLastWindow() {
            assertEquals(4.0, TechnicalIndicators.sma(List.of(1.0, 2.0, 3.0, 4.0, 5.0), 3));
        }

        @Test
        @DisplayName("EMA of a constant series is the constant")
        void emaConstant() {
            assertEquals(10.0, TechnicalIndicators.ema(Collections.nCopies(30, 10.0), 9), 1e-9);
        }

        @Test
        @DisplayName("EMA follows a rising series but lags it")
        void emaLags() {
            List<Double> values = new ArrayList<>();
            for (int i = 1; i <= 40; i++) values.add((double) i);
            double ema9 = TechnicalIndicators.ema(values, 9);
            double ema21 = TechnicalIndicators.ema(values, 21);
            assertTrue(ema9 < 40.0);
            assertTrue(ema9 > ema21);
        }

        @Test
        @DisplayName("insufficient data → NaN")
        void insufficient() {
            assertTrue(Double.isNaN(TechnicalIndicators.ema(List.of(1.0, 2.0), 9)));
            assertTrue(Double.isNaN(TechnicalIndicators.sma(null, 3)));
        }
    }

    @Nested
    @DisplayName("oscillators and ranges")
    class OscillatorTests {

        @Test
        @DisplayName("strictly rising closes → RSI 100")
        void rsiRising() {
            List<Double> values = new ArrayList<>();
            for (int i = 0; i < 20; i++) values.add(100.0 + i);
            assertEquals(100.0, TechnicalIndicators.rsi(values, 14));
        }

        @Test
        @DisplayName("constant 2-point range → ATR 2")
        void atrFlat() {
            assertEquals(2.0, TechnicalIndicators.atr(flatCandles(20), 14), 1e-9);
        }

        @Test
        @DisplayName("steady uptrend → high ADX with +DI above −DI")
        void adxUptrend() {
            TechnicalIndicators.DirectionalIndex dmi = TechnicalIndicators.directionalIndex(risingCandles(40), 14);
            assertTrue(dmi.adx() > 25.0);
            assertTrue(dmi.diDiff() > 0.0);
        }

        @Test
        @DisplayName("too few candles for ADX → NaN")
        void adxInsufficient() {
            assertTrue(Double.isNaN(TechnicalIndicators.directionalIndex(risingCandles(20), 14).adx()));
        }
    }

    @Nested
    @DisplayName("VWAP")
    class VwapTests {

        @Test
        @DisplayName("zero volume → average typical price")
        void zeroVolume() {
            assertEquals(10.0, TechnicalIndicators.vwap(flatCandles(5)), 1e-9);
        }

        @Test
        @DisplayName("volume-weighted when volume is present")
        void weighted() {
            List<Candle> candles = List.of(
                Candle.of(T0, 10, 10, 10, 10, 100),
                Candle.of(T0.plusSeconds(60), 20, 20, 20, 20, 300));
            assertEquals(17.5, TechnicalIndicators.vwap(candles), 1e-9);
        }

        @Test
        @DisplayName("only the latest session is used")
        void latestSessionOnly() {
            List<Candle> candles = List.of(
                Candle.of(T0.minusSeconds(86_400), 50, 50, 50, 50, 1000),
                Candle.of(T0, 10, 10, 10, 10, 100));
            assertEquals(10.0, TechnicalIndicators.vwap(candles), 1e-9);
        }
    }

    @Test
    @DisplayName("default calculator maps NaN to null")
    void defaultCalculatorNulls() {
        DefaultIndicatorCalculator calc = new DefaultIndicatorCalculator();
        assertNull(calc.ema(List.of(1.0), 9));
        assertNull(calc.adx(risingCandles(5), 14));
        assertNotNull(calc.atr(flatCandles(20), 14));
    }
}
