package com.tradeagent.common.model;

/**
 * Immutable per-timeframe fact sheet built once per pipeline run.
 *
 * <p>Implementations: {@link TrendContext} (15m), {@link SetupContext} (5m),
 * {@link TriggerContext} (1m). Each exposes the outcome of its own gate through
 * {@link #gatePassed()}; a context whose status is not {@link ContextStatus#COMPLETE}
 * never passes.
 */
public interface TimeframeContext {

    Timeframe timeframe();

    ContextStatus status();

    /** Close of the most recent candle, or {@code null} when no data was available. */
    Double latestClose();

    /** Error message for {@link ContextStatus#ERROR}; {@code null} otherwise. */
    String error();

    boolean gatePassed();
}
