package com.tradeagent.common.model;

/**
 * Directional bias of the 15-minute trend, decided by the EMA(9) / EMA(21) crossover.
 */
public enum Bias {

    BULLISH,
    BEARISH,
    NEUTRAL;

    /** Option type bought in the direction of this bias, or {@code null} when neutral. */
    public OptionType optionType() {
        return switch (this) {
            case BULLISH -> OptionType.CE;
            case BEARISH -> OptionType.PE;
            case NEUTRAL -> null;
        };
    }

    public boolean isDirectional() {
        return this != NEUTRAL;
    }

    /** Derives the bias from the two moving averages. Missing inputs → NEUTRAL. */
    public static Bias fromEmaCross(Double fast, Double slow) {
        if (fast == null || slow == null) return NEUTRAL;
        if (fast > slow) return BULLISH;
        if (fast < slow) return BEARISH;
        return NEUTRAL;
    }
}
