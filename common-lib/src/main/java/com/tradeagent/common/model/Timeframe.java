package com.tradeagent.common.model;

/**
 * The three intraday timeframes the gate pipeline walks through, highest first.
 *
 * <ul>
 *   <li>FIFTEEN_MINUTE: trend permission, 30 days of history</li>
 *   <li>FIVE_MINUTE:    setup quality, 7 days of history</li>
 *   <li>ONE_MINUTE:     entry trigger, current session only</li>
 * </ul>
 */
public enum Timeframe {

    FIFTEEN_MINUTE("15", "15m", 30),
    FIVE_MINUTE("5", "5m", 7),
    ONE_MINUTE("1", "1m", 1);

    private final String code;
    private final String label;
    private final int lookbackDays;

    Timeframe(String code, String label, int lookbackDays) {
        this.code = code;
        this.label = label;
        this.lookbackDays = lookbackDays;
    }

    /** Broker interval code (minutes as a string). */
    public String code() {
        return code;
    }

    /** Short label used in gate names and logs, e.g. {@code "15m"}. */
    public String label() {
        return label;
    }

    public int lookbackDays() {
        return lookbackDays;
    }
}
