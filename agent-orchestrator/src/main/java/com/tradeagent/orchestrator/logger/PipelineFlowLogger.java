package com.tradeagent.orchestrator.logger;

import com.tradeagent.common.model.PipelineResult;
import com.tradeagent.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

/**
 * One log line per pipeline stage, tagged with the run id from MDC. Pure side effects.
 *
 * <p>Stages in order:
 * <ol>
 *   <li>{@link #RUN_STARTED}</li>
 *   <li>{@link #TREND_EVALUATED}: 15m context built</li>
 *   <li>{@link #SETUP_EVALUATED}: 5m context built</li>
 *   <li>{@link #OPTIONS_SELECTED}: chain filtered and scored</li>
 *   <li>{@link #TRIGGER_EVALUATED}: 1m context built</li>
 *   <li>{@link #BRIEF_ASSEMBLED}</li>
 *   <li>{@link #RECOMMENDATION_CREATED}</li>
 * </ol>
 * {@link #GATE_FAILED} replaces the remaining stages when a gate short-circuits the run.
 */
@Component
public class PipelineFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineFlowLogger.class);

    public static final String RUN_STARTED            = "RUN_STARTED";
    public static final String TREND_EVALUATED        = "TREND_EVALUATED";
    public static final String SETUP_EVALUATED        = "SETUP_EVALUATED";
    public static final String OPTIONS_SELECTED       = "OPTIONS_SELECTED";
    public static final String TRIGGER_EVALUATED      = "TRIGGER_EVALUATED";
    public static final String BRIEF_ASSEMBLED        = "BRIEF_ASSEMBLED";
    public static final String RECOMMENDATION_CREATED = "RECOMMENDATION_CREATED";
    public static final String GATE_FAILED            = "GATE_FAILED";

    public void stage(String stageName, String symbol, Object detail) {
        log.info("[PipelineFlow] stage={} symbol={} detail={} traceId={}",
                 stageName, symbol, detail, MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    public void gateFailed(String symbol, String reason) {
        log.info("[PipelineFlow] stage={} symbol={} reason={} traceId={}",
                 GATE_FAILED, symbol, reason, MDC.get(TraceContextUtil.TRACE_ID_KEY));
    }

    /** Compact summary of a finished run: decision, confidence, gates and error count. */
    public void completed(PipelineResult result) {
        log.info("[PipelineFlow] stage={} symbol={} decision={} confidence={} gatesPassed={} errors={} traceId={}",
                 RECOMMENDATION_CREATED, result.symbol(), result.recommendation().decision(),
                 result.recommendation().confidence(), result.gatesPassed(), result.errors().size(),
                 result.runId());
    }
}
