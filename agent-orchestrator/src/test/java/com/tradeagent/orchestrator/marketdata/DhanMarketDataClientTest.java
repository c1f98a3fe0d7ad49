package com.tradeagent.orchestrator.marketdata;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.exception.DataSourceException;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.OptionQuote;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.common.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DhanMarketDataClientTest {

    private final DhanMarketDataClient client = new DhanMarketDataClient(
        WebClient.create("https://api.dhan.co"), new ObjectMapper(), Map.of("NIFTY", "13"),
        Duration.ofSeconds(15), Clock.systemUTC());

    @Nested
    @DisplayName("parseCandles()")
    class CandleTests {

        @Test
        @DisplayName("columnar arrays become candles sorted oldest first")
        void columnar() {
            List<Candle> candles = client.parseCandles("""
                {"open": [101.0, 100.0], "high": [103.0, 102.0], "low": [100.5, 99.0],
                 "close": [102.5, 101.0], "volume": [1200, 900],
                 "timestamp": [1736919000, 1736918100]}
                """);
            assertEquals(2, candles.size());
            assertEquals(Instant.ofEpochSecond(1736918100L), candles.get(0).timestamp());
            assertEquals(101.0, candles.get(0).close());
            assertEquals(1200L, candles.get(1).volume());
        }

        @Test
        @DisplayName("missing volume reads as zero")
        void noVolume() {
            List<Candle> candles = client.parseCandles(
                "{\"open\":[1],\"high\":[2],\"low\":[0.5],\"close\":[1.5],\"timestamp\":[1736918100]}");
            assertEquals(0L, candles.get(0).volume());
        }

        @Test
        @DisplayName("broker failure payload raises DataSourceException")
        void failure() {
            DataSourceException e = assertThrows(DataSourceException.class, () -> client.parseCandles(
                "{\"errorType\":\"Invalid_Authentication\",\"errorCode\":\"DH-901\",\"errorMessage\":\"Client ID or user generated access token is invalid or expired.\"}"));
            assertTrue(e.getMessage().startsWith("[DhanHQ] request rejected"));
        }

        @Test
        @DisplayName("payload without timestamps raises DataSourceException")
        void noTimestamps() {
            assertThrows(DataSourceException.class, () -> client.parseCandles("{\"open\": []}"));
        }
    }

    @Nested
    @DisplayName("expiries")
    class ExpiryTests {

        @Test
        @DisplayName("expiry list is parsed and sorted, bad dates skipped")
        void parse() {
            List<LocalDate> expiries = client.parseExpiries(
                "{\"data\":[\"2025-01-23\",\"2025-01-16\",\"soon\"],\"status\":\"success\"}");
            assertEquals(List.of(LocalDate.of(2025, 1, 16), LocalDate.of(2025, 1, 23)), expiries);
        }

        @Test
        @DisplayName("nearest expiry on or after today")
        void nearest() {
            List<LocalDate> expiries = List.of(LocalDate.of(2025, 1, 9), LocalDate.of(2025, 1, 16),
                                               LocalDate.of(2025, 1, 23));
            assertEquals(LocalDate.of(2025, 1, 16), DhanMarketDataClient.nearestExpiry(expiries, LocalDate.of(2025, 1, 15)));
            assertEquals(LocalDate.of(2025, 1, 16), DhanMarketDataClient.nearestExpiry(expiries, LocalDate.of(2025, 1, 16)));
            assertNull(DhanMarketDataClient.nearestExpiry(expiries, LocalDate.of(2025, 2, 1)));
        }
    }

    @Test
    @DisplayName("option chain maps both sides, greeks and OI change")
    void optionChain() {
        LocalDate expiry = LocalDate.of(2025, 1, 16);
        OptionChain chain = client.parseOptionChain("NIFTY", List.of(expiry), expiry, """
            {"data": {"last_price": 23510.5, "oc": {
               "23550.000000": {
                 "ce": {"last_price": 120.5, "top_bid_price": 120.0, "top_ask_price": 121.0,
                        "implied_volatility": 13.2, "oi": 1100, "previous_oi": 1000, "volume": 50000,
                        "greeks": {"delta": 0.42, "gamma": 0.002, "theta": -12.5, "vega": 9.1}}},
               "23500.000000": {
                 "ce": {"last_price": 150.0, "top_bid_price": 149.5, "top_ask_price": 150.5},
                 "pe": {"last_price": 140.0, "top_bid_price": 139.0, "top_ask_price": 141.0}}
            }}, "status": "success"}
            """);

        assertEquals(23510.5, chain.spotPrice());
        assertEquals(expiry, chain.expiry());
        assertEquals(3, chain.quotes().size());
        assertEquals(23500.0, chain.quotes().get(0).strike());

        OptionQuote ce = chain.quotes().stream()
            .filter(q -> q.strike() == 23550.0 && q.optionType() == OptionType.CE)
            .findFirst().orElseThrow();
        assertEquals(0.42, ce.delta());
        assertEquals(0.1, ce.oiChange(), 1e-9);
        assertNull(ce.ivChange());
        assertEquals(50000L, ce.volume());
        assertTrue(ce.hasTwoSidedQuote());
    }

    @Test
    @DisplayName("unknown symbol fails before any request")
    void unknownSymbol() {
        DataSourceException e = assertThrows(DataSourceException.class, () -> client.fetchCandles(
            "SENSEX", Timeframe.FIFTEEN_MINUTE, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 15)));
        assertEquals("[DhanHQ] no security id configured for SENSEX", e.getMessage());
    }
}
