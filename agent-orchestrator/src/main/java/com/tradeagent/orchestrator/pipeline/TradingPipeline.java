package com.tradeagent.orchestrator.pipeline;

import com.tradeagent.analysis.timeframe.SetupAnalysis;
import com.tradeagent.analysis.timeframe.SetupAnalyzer;
import com.tradeagent.analysis.timeframe.TrendAnalysis;
import com.tradeagent.analysis.timeframe.TrendAnalyzer;
import com.tradeagent.analysis.timeframe.TriggerAnalysis;
import com.tradeagent.analysis.timeframe.TriggerAnalyzer;
import com.tradeagent.common.contract.StructuredBrief;
import com.tradeagent.common.exception.DataSourceException;
import com.tradeagent.common.model.Bias;
import com.tradeagent.common.model.Candle;
import com.tradeagent.common.model.OptionCandidate;
import com.tradeagent.common.model.OptionChain;
import com.tradeagent.common.model.PipelineResult;
import com.tradeagent.common.model.Recommendation;
import com.tradeagent.common.model.Timeframe;
import com.tradeagent.common.model.TimeframeContext;
import com.tradeagent.common.session.TradingSessionClassifier;
import com.tradeagent.common.trace.TraceContextUtil;
import com.tradeagent.orchestrator.config.PipelineSettings;
import com.tradeagent.orchestrator.logger.PipelineFlowLogger;
import com.tradeagent.orchestrator.marketdata.MarketDataGateway;
import com.tradeagent.orchestrator.strategy.DeterministicRecommender;
import com.tradeagent.orchestrator.strategy.RecommendationAdvisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Four-gate pipeline: 15m trend permission → 5m setup → option-chain feasibility → 1m trigger.
 *
 * <p>Each gate must pass before the next stage fetches anything. A data-source failure marks
 * that stage's context {@code ERROR} and fails its gate. Gate failures produce a
 * {@code NO_TRADE} recommendation with confidence 0.0 and the rationale
 * {@code "Gate failed: <reason>"}. Only when all four pass is the brief built and, with the
 * model enabled, handed to the {@link RecommendationAdvisor}; otherwise the deterministic
 * recommendation stands.
 *
 * <p>{@link #run} never throws.
 */
@Service
public class TradingPipeline {

    private static final Logger log = LoggerFactory.getLogger(TradingPipeline.class);

    static final String GATE_15M     = "15m";
    static final String GATE_5M      = "5m";
    static final String GATE_OPTIONS = "options";
    static final String GATE_1M      = "1m";

    private final MarketDataGateway marketData;
    private final TrendAnalyzer trendAnalyzer;
    private final SetupAnalyzer setupAnalyzer;
    private final TriggerAnalyzer triggerAnalyzer;
    private final RecommendationAdvisor advisor;
    private final PipelineSettings settings;
    private final PipelineFlowLogger flowLogger;
    private final Clock clock;
    private final OptionCandidateSelector candidateSelector;
    private final BriefAssembler briefAssembler;

    public TradingPipeline(MarketDataGateway marketData,
                           TrendAnalyzer trendAnalyzer,
                           SetupAnalyzer setupAnalyzer,
                           TriggerAnalyzer triggerAnalyzer,
                           RecommendationAdvisor advisor,
                           PipelineSettings settings,
                           PipelineFlowLogger flowLogger,
                           Clock clock) {
        this.marketData        = marketData;
        this.trendAnalyzer     = trendAnalyzer;
        this.setupAnalyzer     = setupAnalyzer;
        this.triggerAnalyzer   = triggerAnalyzer;
        this.advisor           = advisor;
        this.settings          = settings;
        this.flowLogger        = flowLogger;
        this.clock             = clock;
        this.candidateSelector = new OptionCandidateSelector(settings);
        this.briefAssembler    = new BriefAssembler(settings, clock);
    }

    public PipelineResult run(String symbol) {
        String runId = TraceContextUtil.newRunId();
        String normalized = symbol == null ? "" : symbol.trim().toUpperCase();
        return TraceContextUtil.callWithMdc(runId, () -> execute(normalized, runId));
    }

    private PipelineResult execute(String symbol, String runId) {
        Run run = new Run(symbol, runId);
        flowLogger.stage(PipelineFlowLogger.RUN_STARTED, symbol, "llmEnabled=" + settings.llmEnabled());

        try {
            LocalDate today = TradingSessionClassifier.lastTradingDate(clock.instant());

            // ── gate 1: 15m trend permission ────────────────────────────────
            TrendAnalysis trend = analyze(run, Timeframe.FIFTEEN_MINUTE, today,
                candles -> trendAnalyzer.analyze(candles, Bias.NEUTRAL), TrendAnalysis::failed);
            run.contexts.put(GATE_15M, trend.context());
            flowLogger.stage(PipelineFlowLogger.TREND_EVALUATED, symbol, trend.context().bias());
            if (!trend.context().gatePassed()) {
                return run.gateFailed(withError("15m: trade not allowed", trend.context()));
            }
            run.gatesPassed.add(GATE_15M);

            // ── gate 2: 5m setup ────────────────────────────────────────────
            Bias bias = trend.context().bias();
            SetupAnalysis setup = analyze(run, Timeframe.FIVE_MINUTE, today,
                candles -> setupAnalyzer.analyze(candles, bias), SetupAnalysis::failed);
            run.contexts.put(GATE_5M, setup.context());
            flowLogger.stage(PipelineFlowLogger.SETUP_EVALUATED, symbol, setup.context().setupType());
            if (!setup.context().gatePassed()) {
                return run.gateFailed(withError("5m: setup not ready", setup.context()));
            }
            run.gatesPassed.add(GATE_5M);

            // ── gate 3: option-chain feasibility ────────────────────────────
            OptionChain chain = fetchChain(run);
            run.candidates = candidateSelector.select(chain, bias);
            flowLogger.stage(PipelineFlowLogger.OPTIONS_SELECTED, symbol, run.candidates.size() + " candidates");
            if (run.candidates.isEmpty()) {
                return run.gateFailed("options: no viable strikes");
            }
            run.gatesPassed.add(GATE_OPTIONS);

            // ── gate 4: 1m trigger ──────────────────────────────────────────
            TriggerAnalysis trigger = analyze(run, Timeframe.ONE_MINUTE, today,
                candles -> triggerAnalyzer.analyze(candles, bias), TriggerAnalysis::failed);
            run.contexts.put(GATE_1M, trigger.context());
            flowLogger.stage(PipelineFlowLogger.TRIGGER_EVALUATED, symbol, trigger.context().entrySignal());
            if (!trigger.context().gatePassed()) {
                return run.gateFailed(withError("1m: entry trigger not confirmed", trigger.context()));
            }
            run.gatesPassed.add(GATE_1M);

            // ── all gates passed ────────────────────────────────────────────
            StructuredBrief brief = briefAssembler.assemble(symbol, trend, setup, trigger, run.candidates,
                                                            chain != null ? chain.expiry() : null);
            flowLogger.stage(PipelineFlowLogger.BRIEF_ASSEMBLED, symbol, brief.marketConditions());

            Recommendation deterministic = DeterministicRecommender.recommend(
                trend.context(), setup.context(), trigger.context(), run.candidates, run.gatesPassed);
            Recommendation recommendation = settings.llmEnabled()
                ? advisor.advise(symbol, brief, run.candidates, deterministic)
                : deterministic;
            return run.finish(recommendation);
        } catch (RuntimeException e) {
            log.error("[Pipeline] Unexpected failure. symbol={} runId={}", symbol, runId, e);
            run.errors.add("pipeline: " + e.getMessage());
            return run.finish(Recommendation.noTrade("Pipeline error: " + e.getMessage(), run.gatesPassed));
        }
    }

    // ── stages ───────────────────────────────────────────────────────────────

    private <A> A analyze(Run run, Timeframe timeframe, LocalDate today,
                          Function<List<Candle>, A> analyzer, Function<String, A> failed) {
        try {
            List<Candle> candles = marketData.fetchCandles(run.symbol, timeframe,
                today.minusDays(timeframe.lookbackDays()), today);
            return analyzer.apply(candles);
        } catch (DataSourceException e) {
            log.warn("[Pipeline] Data source failed. symbol={} timeframe={} error={}",
                     run.symbol, timeframe.label(), e.getMessage());
            run.errors.add(timeframe.label() + ": " + e.getMessage());
            return failed.apply(e.getMessage());
        }
    }

    private OptionChain fetchChain(Run run) {
        try {
            return marketData.fetchOptionChain(run.symbol);
        } catch (DataSourceException e) {
            log.warn("[Pipeline] Option chain unavailable. symbol={} error={}", run.symbol, e.getMessage());
            run.errors.add(GATE_OPTIONS + ": " + e.getMessage());
            return null;
        }
    }

    private static String withError(String reason, TimeframeContext context) {
        return context.error() != null ? reason + " (" + context.error() + ")" : reason;
    }

    /** Mutable bookkeeping of one run; never leaves {@link #execute}. */
    private final class Run {
        final String symbol;
        final String runId;
        final Map<String, TimeframeContext> contexts = new LinkedHashMap<>();
        final List<String> gatesPassed = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        List<OptionCandidate> candidates = List.of();

        Run(String symbol, String runId) {
            this.symbol = symbol;
            this.runId = runId;
        }

        PipelineResult gateFailed(String reason) {
            flowLogger.gateFailed(symbol, reason);
            return finish(Recommendation.noTrade("Gate failed: " + reason, gatesPassed));
        }

        PipelineResult finish(Recommendation recommendation) {
            PipelineResult result = new PipelineResult(symbol, runId, clock.instant(), recommendation,
                contexts, candidates, errors, gatesPassed);
            flowLogger.completed(result);
            return result;
        }
    }
}
