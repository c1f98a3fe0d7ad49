package com.tradeagent.orchestrator.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.exception.DataSourceException;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.OptionQuote;
import com.tradeagent.common.model.OptionType;
import com.tradeagent.common.model.Timeframe;
import com.tradeagent.common.session.TradingSessionClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DhanHQ v2 REST adapter: intraday charts, option-chain expiry list and option chain.
 *
 * <p>The {@link WebClient} carries the {@code access-token}/{@code client-id} headers and the
 * transport timeouts. Each call blocks here, at the adapter boundary.
 */
public class DhanMarketDataClient implements MarketDataGateway {

    private static final Logger log = LoggerFactory.getLogger(DhanMarketDataClient.class);
    private static final String SOURCE = "DhanHQ";

    static final String EXCHANGE_SEGMENT = "IDX_I";
    static final String INSTRUMENT       = "INDEX";

    private static final DateTimeFormatter DHAN_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> securityIds;
    private final Duration timeout;
    private final Clock clock;

    public DhanMarketDataClient(WebClient dhanWebClient, ObjectMapper objectMapper,
                                Map<String, String> securityIds, Duration timeout, Clock clock) {
        this.webClient    = dhanWebClient;
        this.objectMapper = objectMapper;
        this.securityIds  = securityIds;
        this.timeout      = timeout;
        this.clock        = clock;
    }

    @Override
    public List<Candle> fetchCandles(String symbol, Timeframe timeframe, LocalDate from, LocalDate to) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("securityId", securityId(symbol));
        body.put("exchangeSegment", EXCHANGE_SEGMENT);
        body.put("instrument", INSTRUMENT);
        body.put("interval", timeframe.code());
        body.put("oi", false);
        body.put("fromDate", from.atTime(9, 15).format(DHAN_FMT));
        body.put("toDate", to.atTime(15, 30).format(DHAN_FMT));

        List<Candle> candles = parseCandles(post("/v2/charts/intraday", body));
        log.info("[DhanHQ] Candles fetched. symbol={} timeframe={} count={}", symbol, timeframe.label(), candles.size());
        return candles;
    }

    @Override
    public OptionChain fetchOptionChain(String symbol) {
        int scrip = Integer.parseInt(securityId(symbol));

        Map<String, Object> expiryBody = new LinkedHashMap<>();
        expiryBody.put("UnderlyingScrip", scrip);
        expiryBody.put("UnderlyingSeg", EXCHANGE_SEGMENT);
        List<LocalDate> expiries = parseExpiries(post("/v2/optionchain/expirylist", expiryBody));

        LocalDate today = LocalDate.now(clock.withZone(TradingSessionClassifier.IST));
        LocalDate expiry = nearestExpiry(expiries, today);
        if (expiry == null) {
            throw new DataSourceException(SOURCE, "no upcoming expiry for " + symbol);
        }

        Map<String, Object> chainBody = new LinkedHashMap<>(expiryBody);
        chainBody.put("Expiry", expiry.toString());
        OptionChain chain = parseOptionChain(symbol, expiries, expiry, post("/v2/optionchain", chainBody));
        log.info("[DhanHQ] Option chain fetched. symbol={} expiry={} quotes={} spot={}",
                 symbol, expiry, chain.quotes().size(), chain.spotPrice());
        return chain;
    }

    // ── transport ────────────────────────────────────────────────────────────

    private String post(String uri, Map<String, Object> body) {
        try {
            String json = webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .block();
            if (json == null || json.isBlank()) {
                throw new DataSourceException(SOURCE, "empty response from " + uri);
            }
            return json;
        } catch (WebClientResponseException e) {
            throw new DataSourceException(SOURCE, "HTTP " + e.getStatusCode().value() + " from " + uri, e);
        } catch (DataSourceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataSourceException(SOURCE, uri + " failed: " + e.getMessage(), e);
        }
    }

    private String securityId(String symbol) {
        String id = securityIds.get(symbol.toUpperCase());
        if (id == null) {
            throw new DataSourceException(SOURCE, "no security id configured for " + symbol);
        }
        return id;
    }

    // ── parsing ──────────────────────────────────────────────────────────────

    /**
     * Columnar chart payload: parallel {@code open/high/low/close/volume/timestamp} arrays,
     * timestamps in epoch seconds.
     */
    List<Candle> parseCandles(String json) {
        JsonNode root = readTree(json);
        rejectFailure(root);
        JsonNode timestamps = root.path("timestamp");
        if (!timestamps.isArray()) {
            throw new DataSourceException(SOURCE, "chart response has no timestamp array");
        }

        List<Candle> candles = new ArrayList<>(timestamps.size());
        for (int i = 0; i < timestamps.size(); i++) {
            candles.add(Candle.of(
                Instant.ofEpochSecond((long) timestamps.get(i).asDouble()),
                root.path("open").path(i).asDouble(),
                root.path("high").path(i).asDouble(),
                root.path("low").path(i).asDouble(),
                root.path("close").path(i).asDouble(),
                root.path("volume").path(i).asLong(0)));
        }
        candles.sort(Comparator.comparing(Candle::timestamp));
        return candles;
    }

    List<LocalDate> parseExpiries(String json) {
        JsonNode root = readTree(json);
        rejectFailure(root);
        List<LocalDate> expiries = new ArrayList<>();
        for (JsonNode date : root.path("data")) {
            try {
                expiries.add(LocalDate.parse(date.asText()));
            } catch (DateTimeParseException e) {
                log.warn("[DhanHQ] Skipping unparseable expiry. value={}", date.asText());
            }
        }
        expiries.sort(Comparator.naturalOrder());
        return expiries;
    }

    static LocalDate nearestExpiry(List<LocalDate> expiries, LocalDate today) {
        return expiries.stream()
            .filter(d -> !d.isBefore(today))
            .min(Comparator.naturalOrder())
            .orElse(null);
    }

    /**
     * Chain payload: {@code data.last_price} and {@code data.oc}, keyed by strike
     * ({@code "25000.000000"}), each with optional {@code ce}/{@code pe} blocks.
     */
    OptionChain parseOptionChain(String symbol, List<LocalDate> expiries, LocalDate expiry, String json) {
        JsonNode root = readTree(json);
        rejectFailure(root);
        JsonNode data = root.path("data");
        double spot = data.path("last_price").asDouble(0.0);

        List<OptionQuote> quotes = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> strikes = data.path("oc").fields();
        while (strikes.hasNext()) {
            Map.Entry<String, JsonNode> entry = strikes.next();
            double strike;
            try {
                strike = Double.parseDouble(entry.getKey());
            } catch (NumberFormatException e) {
                log.warn("[DhanHQ] Skipping unparseable strike. value={}", entry.getKey());
                continue;
            }
            JsonNode ce = entry.getValue().path("ce");
            JsonNode pe = entry.getValue().path("pe");
            if (ce.isObject()) quotes.add(toQuote(strike, OptionType.CE, ce));
            if (pe.isObject()) quotes.add(toQuote(strike, OptionType.PE, pe));
        }
        quotes.sort(Comparator.comparingDouble(OptionQuote::strike));
        return new OptionChain(symbol, spot, expiries, expiry, quotes);
    }

    private static OptionQuote toQuote(double strike, OptionType type, JsonNode side) {
        JsonNode greeks = side.path("greeks");
        Long oi = longOrNull(side, "oi");
        Long previousOi = longOrNull(side, "previous_oi");
        Double oiChange = (oi != null && previousOi != null && previousOi > 0)
            ? (oi - previousOi) / (double) previousOi
            : null;
        return new OptionQuote(
            strike, type,
            doubleOrNull(side, "top_bid_price"),
            doubleOrNull(side, "top_ask_price"),
            doubleOrNull(side, "last_price"),
            doubleOrNull(greeks, "delta"),
            doubleOrNull(greeks, "gamma"),
            doubleOrNull(greeks, "theta"),
            doubleOrNull(greeks, "vega"),
            doubleOrNull(side, "implied_volatility"),
            null,
            oi,
            oiChange,
            longOrNull(side, "volume"));
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DataSourceException(SOURCE, "unparseable response body", e);
        }
    }

    private static void rejectFailure(JsonNode root) {
        if ("failure".equalsIgnoreCase(root.path("status").asText())
            || root.hasNonNull("errorCode")) {
            String message = root.hasNonNull("errorMessage")
                ? root.path("errorMessage").asText()
                : root.path("remarks").toString();
            throw new DataSourceException(SOURCE, "request rejected: " + message);
        }
    }

    private static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asDouble() : null;
    }

    private static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isNumber() ? value.asLong() : null;
    }
}
