package com.tradeagent.common.session;

/**
 * Volatility regime derived from the 15-minute ATR expressed as a percentage of price.
 */
public enum VolatilityRegime {
    LOW,
    NORMAL,
    HIGH,
    UNKNOWN;

    static final double LOW_ATR_PCT  = 0.12;
    static final double HIGH_ATR_PCT = 0.35;

    public static VolatilityRegime fromAtr(Double atr, Double price) {
        if (atr == null || price == null || price <= 0) return UNKNOWN;
        double pct = atr / price * 100.0;
        if (pct < LOW_ATR_PCT)  return LOW;
        if (pct > HIGH_ATR_PCT) return HIGH;
        return NORMAL;
    }

    public String label() {
        return name().toLowerCase();
    }
}
