package com.tradeagent.common.model;

/**
 * Terminal verdict of a pipeline run, banded by confidence.
 *
 * <pre>
 *   ENTER     confidence ≥ 0.70
 *   WAIT      0.50 ≤ confidence &lt; 0.70
 *   NO_TRADE  confidence &lt; 0.50, or any gate failure (confidence 0.0)
 * </pre>
 */
public enum Decision {

    ENTER,
    WAIT,
    NO_TRADE;

    public static final double ENTER_THRESHOLD = 0.70;
    public static final double WAIT_THRESHOLD  = 0.50;

    static final double WAIT_MAX_CONFIDENCE     = 0.69;
    static final double NO_TRADE_MAX_CONFIDENCE = 0.49;

    public static Decision fromConfidence(double confidence) {
        if (confidence >= ENTER_THRESHOLD) return ENTER;
        if (confidence >= WAIT_THRESHOLD)  return WAIT;
        return NO_TRADE;
    }

    /**
     * Reads a verdict as a model writes it: {@code "ENTER"}, {@code "wait"}, {@code "noTrade"},
     * {@code "no_trade"} or {@code "NO TRADE"}.
     *
     * @return the decision, or {@code null} when the text names none
     */
    public static Decision parse(String text) {
        if (text == null) return null;
        String key = text.replaceAll("[^A-Za-z]", "").toUpperCase();
        return switch (key) {
            case "ENTER"   -> ENTER;
            case "WAIT"    -> WAIT;
            case "NOTRADE" -> NO_TRADE;
            default        -> null;
        };
    }

    /** Highest confidence whose band is no more aggressive than this decision. */
    public double capConfidence(double confidence) {
        return switch (this) {
            case ENTER    -> confidence;
            case WAIT     -> Math.min(confidence, WAIT_MAX_CONFIDENCE);
            case NO_TRADE -> Math.min(confidence, NO_TRADE_MAX_CONFIDENCE);
        };
    }
}
