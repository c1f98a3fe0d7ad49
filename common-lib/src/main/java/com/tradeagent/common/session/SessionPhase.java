package com.tradeagent.common.session;

/**
 * Coarse NSE intraday phase used in the market-condition flags of the brief.
 */
public enum SessionPhase {
    OPEN,
    MID,
    CLOSE,
    CLOSED;

    public String label() {
        return name().toLowerCase();
    }
}
