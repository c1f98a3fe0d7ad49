package com.tradeagent.orchestrator.controller;

import com.tradeagent.common.exception.DataSourceException;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.Timeframe;
import com.tradeagent.orchestrator.config.PipelineSettings;
import com.tradeagent.orchestrator.logger.PipelineFlowLogger;
import com.tradeagent.orchestrator.marketdata.MarketDataGateway;
import com.tradeagent.orchestrator.pipeline.TradingPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.LocalDate;
import java.util.List;

import static com.tradeagent.orchestrator.pipeline.PipelineFixtures.*;

class PipelineControllerTest {

    /** Broker that is always down. */
    private static final class UnavailableMarketData implements MarketDataGateway {
        @Override
        public List<Candle> fetchCandles(String symbol, Timeframe timeframe, LocalDate from, LocalDate to) {
            throw new DataSourceException("DhanHQ", "connection refused");
        }

        @Override
        public OptionChain fetchOptionChain(String symbol) {
            throw new DataSourceException("DhanHQ", "connection refused");
        }
    }

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        PipelineSettings settings = PipelineSettings.defaults();
        TradingPipeline pipeline = new TradingPipeline(new UnavailableMarketData(), bullishTrendAnalyzer(),
            pullbackSetupAnalyzer(), triggerAnalyzer(), (symbol, brief, candidates, fallback) -> fallback,
            settings, new PipelineFlowLogger(), CLOCK);
        client = WebTestClient.bindToController(new PipelineController(pipeline, settings)).build();
    }

    @Test
    @DisplayName("health answers OK")
    void health() {
        client.get().uri("/api/v1/pipeline/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }

    @Test
    @DisplayName("a failing broker still yields 200 with a NO_TRADE body")
    void runSymbol() {
        client.get().uri("/api/v1/pipeline/banknifty")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.symbol").isEqualTo("BANKNIFTY")
            .jsonPath("$.recommendation.decision").isEqualTo("NO_TRADE")
            .jsonPath("$.recommendation.confidence").isEqualTo(0.0)
            .jsonPath("$.errors[0]").isEqualTo("15m: [DhanHQ] connection refused")
            .jsonPath("$.gatesPassed.length()").isEqualTo(0);
    }

    @Test
    @DisplayName("run without a symbol uses the configured default")
    void runDefault() {
        client.get().uri("/api/v1/pipeline/run")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.symbol").isEqualTo("NIFTY");
    }
}
