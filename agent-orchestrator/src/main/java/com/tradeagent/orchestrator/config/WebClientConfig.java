package com.tradeagent.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.exception.ConfigurationException;
import com.tradeagent.orchestrator.llm.LlmClient;
import com.tradeagent.orchestrator.llm.OllamaChatClient;
import com.tradeagent.orchestrator.marketdata.DhanMarketDataClient;
import com.tradeagent.orchestrator.marketdata.MarketDataGateway;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Outbound HTTP: the DhanHQ data client and the Ollama chat client.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    static final int CONNECT_TIMEOUT_MILLIS = 5_000;

    @Value("${dhan.base-url:https://api.dhan.co}")
    private String dhanBaseUrl;

    @Value("${dhan.client-id:}")
    private String dhanClientId;

    @Value("${dhan.access-token:}")
    private String dhanAccessToken;

    @Value("${dhan.timeout-seconds:15}")
    private int dhanTimeoutSeconds;

    @Value("${dhan.security-ids:NIFTY:13,BANKNIFTY:25,FINNIFTY:27,MIDCPNIFTY:442,SENSEX:51}")
    private String dhanSecurityIds;

    @Value("${ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ollama.model:llama3.1}")
    private String ollamaModel;

    @Value("${ollama.timeout-seconds:30}")
    private int ollamaTimeoutSeconds;

    // ── DhanHQ ───────────────────────────────────────────────────────────────

    @Bean
    public WebClient dhanWebClient(WebClient.Builder builder) {
        if (dhanClientId == null || dhanClientId.isBlank()) {
            throw new ConfigurationException("dhan.client-id is required (DHAN_CLIENT_ID)");
        }
        if (dhanAccessToken == null || dhanAccessToken.isBlank()) {
            throw new ConfigurationException("dhan.access-token is required (DHAN_ACCESS_TOKEN)");
        }
        return builder.clone()
            .baseUrl(dhanBaseUrl)
            .defaultHeader("access-token", dhanAccessToken)
            .defaultHeader("client-id", dhanClientId)
            .clientConnector(new ReactorClientHttpConnector(httpClient(dhanTimeoutSeconds)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public MarketDataGateway marketDataGateway(WebClient dhanWebClient, ObjectMapper objectMapper, Clock clock) {
        return new DhanMarketDataClient(dhanWebClient, objectMapper, parseSecurityIds(dhanSecurityIds),
            Duration.ofSeconds(dhanTimeoutSeconds), clock);
    }

    // ── Ollama ───────────────────────────────────────────────────────────────

    @Bean
    public WebClient ollamaWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(ollamaBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(ollamaTimeoutSeconds)))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public LlmClient llmClient(WebClient ollamaWebClient, ObjectMapper objectMapper) {
        log.info("[WebClientConfig] Ollama baseUrl={} model={}", ollamaBaseUrl, ollamaModel);
        return new OllamaChatClient(ollamaWebClient, objectMapper, ollamaModel,
            Duration.ofSeconds(ollamaTimeoutSeconds));
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static HttpClient httpClient(int responseTimeoutSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .responseTimeout(Duration.ofSeconds(responseTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(responseTimeoutSeconds, TimeUnit.SECONDS))
            );
    }

    /** Parses {@code SYMBOL:id} pairs separated by commas. */
    static Map<String, String> parseSecurityIds(String raw) {
        Map<String, String> ids = new LinkedHashMap<>();
        if (raw == null) return ids;
        for (String pair : raw.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) continue;
            int colon = trimmed.indexOf(':');
            if (colon <= 0 || colon == trimmed.length() - 1) {
                throw new ConfigurationException("dhan.security-ids entry must be SYMBOL:id, got " + trimmed);
            }
            ids.put(trimmed.substring(0, colon).trim().toUpperCase(), trimmed.substring(colon + 1).trim());
        }
        return ids;
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String token = clientRequest.headers().getFirst("access-token");
            log.debug("[WebClient] Outbound request: {} {} accessToken={}",
                      clientRequest.method(), clientRequest.url(), mask(token));
            return Mono.just(clientRequest);
        });
    }

    static String mask(String secret) {
        if (secret == null || secret.isEmpty()) return "-";
        return secret.length() <= 4 ? "***" : secret.substring(0, 4) + "***";
    }
}
