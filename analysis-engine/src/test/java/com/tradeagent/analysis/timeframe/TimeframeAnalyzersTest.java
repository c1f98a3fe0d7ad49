package com.tradeagent.analysis.timeframe;

import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.ContextStatus;
import com.tradeagent.common.model.EntrySignal;
import com.tradeagent.common.model.SetupContext;
import com.tradeagent.common.model.SetupType;
import com.tradeagent.common.model.TriggerType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TimeframeAnalyzersTest {

    private static final Instant T0 = Instant.parse("2024-06-12T04:00:00Z");

    /** {@code n} quiet candles oscillating around {@code mid}, high/low ±0.5. */
    private static List<Candle> base(int n, double mid) {
        List<Candle> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double open = i % 2 == 0 ? mid - 0.1 : mid + 0.1;
            double close = i % 2 == 0 ? mid + 0.1 : mid - 0.1;
            out.add(Candle.of(T0.plusSeconds(60L * i), open, mid + 0.5, mid - 0.5, close, 0));
        }
        return out;
    }

    private static List<Candle> with(List<Candle> series, double open, double high, double low, double close) {
        List<Candle> out = new ArrayList<>(series);
        out.add(Candle.of(T0.plusSeconds(60L * series.size()), open, high, low, close, 0));
        return out;
    }

    // ── 15m ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("TrendAnalyzer")
    class TrendTests {

        @Test
        @DisplayName("EMA9 105 > EMA21 100 with ADX 28 → bullish, strong, trade allowed")
        void bullishStrong() {
            TrendAnalyzer analyzer = new TrendAnalyzer(new FixedIndicators()
                .ema(9, 105).ema(21, 100).adx(28, 8).atr(0.8).vwap(104.9));
            TrendAnalysis result = analyzer.analyze(base(40, 105), Bias.NEUTRAL);

            assertEquals(ContextStatus.COMPLETE, result.context().status());
            assertEquals(Bias.BULLISH, result.context().bias());
            assertEquals("strong", result.context().strength());
            assertTrue(result.context().tradeAllowed());
            assertTrue(result.context().gatePassed());
        }

        @Test
        @DisplayName("bearish cross with ADX 15 → weak, trade not allowed")
        void bearishWeak() {
            TrendAnalyzer analyzer = new TrendAnalyzer(new FixedIndicators()
                .ema(9, 99).ema(21, 100).adx(15, -3));
            TrendAnalysis result = analyzer.analyze(base(40, 99), Bias.NEUTRAL);

            assertEquals(Bias.BEARISH, result.context().bias());
            assertEquals("weak", result.context().strength());
            assertFalse(result.context().gatePassed());
        }

        @Test
        @DisplayName("missing EMAs → neutral bias, gate closed")
        void missingEmas() {
            TrendAnalysis result = new TrendAnalyzer(new FixedIndicators()).analyze(base(5, 100), Bias.NEUTRAL);
            assertEquals(Bias.NEUTRAL, result.context().bias());
            assertEquals("unknown", result.context().strength());
            assertFalse(result.context().gatePassed());
        }

        @Test
        @DisplayName("empty series → NO_DATA")
        void empty() {
            TrendAnalysis result = new TrendAnalyzer(new FixedIndicators()).analyze(List.of(), Bias.NEUTRAL);
            assertEquals(ContextStatus.NO_DATA, result.context().status());
            assertFalse(result.context().gatePassed());
        }

        @Test
        @DisplayName("rising highs and lows → higher_highs structure with a bullish break")
        void structure() {
            List<Candle> candles = new ArrayList<>(base(20, 100));
            for (int i = 0; i < 10; i++) {
                double mid = 101 + i;
                candles = with(candles, mid - 0.3, mid + 0.5, mid - 0.5, mid + 0.3);
            }
            assertEquals("higher_highs", TrendAnalyzer.marketStructure(candles));
            assertEquals("bullish", TrendAnalyzer.lastBreakOfStructure(candles).direction());
            assertEquals(0, TrendAnalyzer.lastBreakOfStructure(candles).age());
        }

        @Test
        @DisplayName("ATR trend labels")
        void atrTrend() {
            assertEquals("expanding", TrendAnalyzer.atrTrend(1.5, 1.0));
            assertEquals("contracting", TrendAnalyzer.atrTrend(0.5, 1.0));
            assertEquals("stable", TrendAnalyzer.atrTrend(1.0, 1.0));
            assertEquals("stable", TrendAnalyzer.atrTrend(null, 1.0));
        }
    }

    // ── 5m ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("SetupAnalyzer")
    class SetupTests {

        private final SetupAnalyzer analyzer = new SetupAnalyzer(new FixedIndicators()
            .ema(9, 105).rsi(58).vwap(104.5));

        @Test
        @DisplayName("bullish close at EMA9 → pullback, no invalidations, proceed")
        void pullback() {
            List<Candle> candles = with(base(20, 105), 104.9, 105.2, 104.8, 105.1);
            SetupContext ctx = analyzer.analyze(candles, Bias.BULLISH).context();

            assertEquals(SetupType.PULLBACK, ctx.setupType());
            assertTrue(ctx.momentumAligned());
            assertTrue(ctx.invalidations().isEmpty());
            assertTrue(ctx.proceedToEntry());
            assertTrue(ctx.gatePassed());
        }

        @Test
        @DisplayName("bearish candle against a bullish bias → weak_close blocks entry")
        void weakClose() {
            List<Candle> candles = with(base(20, 105), 105.2, 105.3, 104.9, 105.0);
            SetupContext ctx = analyzer.analyze(candles, Bias.BULLISH).context();

            assertTrue(ctx.invalidations().contains(SetupContext.WEAK_CLOSE));
            assertFalse(ctx.proceedToEntry());
        }

        @Test
        @DisplayName("close above the last 10 highs → breakout")
        void breakout() {
            List<Candle> candles = with(base(20, 105), 105.2, 106.4, 105.1, 106.2);
            assertEquals(SetupType.BREAKOUT, analyzer.analyze(candles, Bias.BULLISH).context().setupType());
        }

        @Test
        @DisplayName("bearish bias with close above VWAP → failed_retest")
        void failedRetest() {
            List<Candle> candles = with(base(20, 105), 105.2, 105.3, 104.8, 104.9);
            SetupContext ctx = new SetupAnalyzer(new FixedIndicators().ema(9, 105).rsi(45).vwap(104.0))
                .analyze(candles, Bias.BEARISH).context();
            assertTrue(ctx.invalidations().contains(SetupContext.FAILED_RETEST));
            assertFalse(ctx.gatePassed());
        }

        @Test
        @DisplayName("empty series → NO_DATA with no_data invalidation")
        void empty() {
            SetupContext ctx = analyzer.analyze(List.of(), Bias.BULLISH).context();
            assertEquals(ContextStatus.NO_DATA, ctx.status());
            assertEquals(List.of(SetupContext.NO_DATA), ctx.invalidations());
        }
    }

    // ── 1m ──────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("TriggerAnalyzer")
    class TriggerTests {

        private final TriggerAnalyzer analyzer = new TriggerAnalyzer(new FixedIndicators().atr(0.6).vwap(105.0));

        @Test
        @DisplayName("bullish close above the 10-candle high → range break, confirmed")
        void rangeBreak() {
            List<Candle> candles = with(base(15, 105), 105.2, 106.1, 105.1, 106.0);
            TriggerAnalysis result = analyzer.analyze(candles, Bias.BULLISH);

            assertEquals(TriggerType.RANGE_BREAK, result.context().triggerType());
            assertEquals(EntrySignal.CONFIRMED, result.context().entrySignal());
            assertTrue(result.context().gatePassed());
            assertEquals(103.88, result.context().entryZone().from());
            assertTrue(result.signals().atrSpike());
        }

        @Test
        @DisplayName("small bearish candle under a bullish bias → not confirmed")
        void notConfirmed() {
            List<Candle> candles = with(base(15, 105), 105.05, 105.2, 104.9, 104.95);
            TriggerAnalysis result = analyzer.analyze(candles, Bias.BULLISH);

            assertEquals(EntrySignal.NOT_CONFIRMED, result.context().entrySignal());
            assertFalse(result.context().gatePassed());
        }

        @Test
        @DisplayName("single candle → NO_DATA")
        void tooShort() {
            assertEquals(ContextStatus.NO_DATA,
                analyzer.analyze(base(1, 105), Bias.BULLISH).context().status());
        }
    }
}
