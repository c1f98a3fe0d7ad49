package com.tradeagent.orchestrator.tool;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.exception.ToolExecutionException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the per-run tool set offered to the model. Analysis tools only read the facts they
 * are given (or the run's brief); {@code place_order} is the single execution tool and is
 * refused by the registry outside {@link RegistryMode#LIVE}.
 */
@Component
public class ToolCatalog {

    public static final String VALIDATE_SIGNAL_ALIGNMENT = "validate_signal_alignment";
    public static final String CHECK_MARKET_CONDITIONS   = "check_market_conditions";
    public static final String DETECT_CONTRADICTIONS     = "detect_contradictions";
    public static final String GET_OPTION_CANDIDATES     = "get_option_candidates";
    public static final String PLACE_ORDER               = "place_order";

    private static final double MIN_LIQUIDITY_SCORE = 5.0;

    private final ObjectMapper objectMapper;

    public ToolCatalog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ToolRegistry newRegistry(RegistryMode mode, StructuredBrief brief) {
        ToolRegistry registry = new ToolRegistry(mode);

        registry.register(VALIDATE_SIGNAL_ALIGNMENT,
            "Check whether the 15m, 5m and 1m signals agree with each other",
            params(
                "tf_15m", ParamSpec.required(ParamType.OBJECT, "15m trend context"),
                "tf_5m",  ParamSpec.required(ParamType.OBJECT, "5m setup context"),
                "tf_1m",  ParamSpec.required(ParamType.OBJECT, "1m trigger context")),
            this::validateSignalAlignment);

        registry.register(CHECK_MARKET_CONDITIONS,
            "Check that volatility, trend strength and liquidity suit option buying",
            params(
                "volatility",      ParamSpec.required(ParamType.STRING, "expanding, contracting or stable"),
                "trend_strength",  ParamSpec.required(ParamType.STRING, "strong, moderate, weak or unknown"),
                "liquidity_score", ParamSpec.required(ParamType.NUMBER, "liquidity score from 0 to 10")),
            this::checkMarketConditions);

        registry.register(DETECT_CONTRADICTIONS,
            "Look for signals that contradict each other and may indicate a false move",
            params("signals", ParamSpec.required(ParamType.OBJECT, "signals keyed by timeframe")),
            this::detectContradictions);

        registry.register(GET_OPTION_CANDIDATES,
            "Return the pre-filtered, pre-scored option strikes for this run",
            Map.of(),
            args -> brief != null ? brief.optionStrikes() : List.of());

        registry.register(PLACE_ORDER,
            "Place an option order. Execution tool, live mode only. Do not use unless explicitly authorized.",
            params(
                "symbol",      ParamSpec.required(ParamType.STRING, "index symbol"),
                "side",        ParamSpec.required(ParamType.STRING, "buy or sell"),
                "qty",         ParamSpec.required(ParamType.INTEGER, "quantity in lots"),
                "price",       ParamSpec.optional(ParamType.NUMBER, "limit price"),
                "strike",      ParamSpec.required(ParamType.STRING, "strike price"),
                "option_type", ParamSpec.required(ParamType.STRING, "CE or PE")),
            ToolCategory.EXECUTION,
            this::placeOrder);

        return registry;
    }

    // ── handlers ─────────────────────────────────────────────────────────────

    Map<String, Object> validateSignalAlignment(Map<String, Object> args) {
        JsonNode tf15m = objectMapper.valueToTree(args.get("tf_15m"));
        JsonNode tf5m  = objectMapper.valueToTree(args.get("tf_5m"));
        JsonNode tf1m  = objectMapper.valueToTree(args.get("tf_1m"));

        String direction = text(tf15m, "/trend/direction", "/bias");
        String setupType = text(tf5m, "/setup/type", "/setup_type");
        boolean momentumAligned = bool(tf5m, "/momentum/aligned", "/momentum_alignment");
        String entrySignal = text(tf1m, "/trigger/status", "/entry_signal");

        List<String> contradictions = new ArrayList<>();
        if (opposite(direction, setupType)) {
            contradictions.add("15m " + direction.toLowerCase() + " but 5m " + setupType.toLowerCase());
        }
        if (!momentumAligned) {
            contradictions.add("5m momentum not aligned with 15m");
        }
        if (!"confirmed".equalsIgnoreCase(entrySignal)) {
            contradictions.add("1m entry signal not confirmed");
        }

        boolean aligned = contradictions.isEmpty();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("aligned", aligned);
        data.put("contradictions", contradictions);
        data.put("recommendation", aligned ? "proceed" : "wait");
        return data;
    }

    Map<String, Object> checkMarketConditions(Map<String, Object> args) {
        MarketConditionsRequest request = objectMapper.convertValue(args, MarketConditionsRequest.class);

        boolean suitable = true;
        List<String> warnings = new ArrayList<>();
        if ("contracting".equalsIgnoreCase(request.volatility())) {
            suitable = false;
            warnings.add("Volatility contracting, poor for options");
        }
        if ("weak".equalsIgnoreCase(request.trendStrength())) {
            warnings.add("Weak trend, lower confidence");
        }
        if (request.liquidityScore() < MIN_LIQUIDITY_SCORE) {
            suitable = false;
            warnings.add("Low liquidity, avoid trading");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("suitable", suitable);
        data.put("warnings", warnings);
        data.put("recommendation", suitable ? "proceed" : "avoid");
        return data;
    }

    Map<String, Object> detectContradictions(Map<String, Object> args) {
        JsonNode signals = objectMapper.valueToTree(args.get("signals"));

        String bias15m = text(signals, "/tf_15m_bias", "/tf_15m/trend/direction");
        String setup5m = text(signals, "/tf_5m_setup", "/tf_5m/setup/type");
        String trigger1m = text(signals, "/tf_1m_trigger", "/tf_1m/trigger/status");

        List<String> contradictions = new ArrayList<>();
        if (opposite(bias15m, setup5m)) {
            contradictions.add("Bias mismatch between 15m and 5m");
        }
        if (!bias15m.isEmpty() && "none".equalsIgnoreCase(trigger1m)) {
            contradictions.add("15m bias without any 1m trigger");
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("contradictions", contradictions);
        data.put("hasContradictions", !contradictions.isEmpty());
        data.put("recommendation", contradictions.isEmpty() ? "signals_consistent" : "signals_conflicting");
        return data;
    }

    Object placeOrder(Map<String, Object> args) {
        OrderRequest order = objectMapper.convertValue(args, OrderRequest.class);
        throw new ToolExecutionException(PLACE_ORDER,
            "Order execution is not supported. symbol=" + order.symbol() + " strike=" + order.strike()
                + " optionType=" + order.optionType());
    }

    // ── request records ──────────────────────────────────────────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MarketConditionsRequest(
        @JsonProperty("volatility") String volatility,
        @JsonProperty("trend_strength") String trendStrength,
        @JsonProperty("liquidity_score") double liquidityScore
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OrderRequest(
        @JsonProperty("symbol") String symbol,
        @JsonProperty("side") String side,
        @JsonProperty("qty") int qty,
        @JsonProperty("price") Double price,
        @JsonProperty("strike") String strike,
        @JsonProperty("option_type") String optionType
    ) {}

    // ── helpers ──────────────────────────────────────────────────────────────

    private static Map<String, ParamSpec> params(Object... pairs) {
        Map<String, ParamSpec> params = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            params.put((String) pairs[i], (ParamSpec) pairs[i + 1]);
        }
        return params;
    }

    /** First non-missing text among the JSON pointers, or "". */
    private static String text(JsonNode node, String... pointers) {
        for (String pointer : pointers) {
            JsonNode value = node.at(pointer);
            if (!value.isMissingNode() && !value.isNull()) return value.asText();
        }
        return "";
    }

    private static boolean bool(JsonNode node, String... pointers) {
        for (String pointer : pointers) {
            JsonNode value = node.at(pointer);
            if (!value.isMissingNode() && !value.isNull()) return value.asBoolean();
        }
        return false;
    }

    private static boolean opposite(String a, String b) {
        String x = a.toLowerCase();
        String y = b.toLowerCase();
        return (x.contains("bullish") && y.contains("bearish")) || (x.contains("bearish") && y.contains("bullish"));
    }
}
