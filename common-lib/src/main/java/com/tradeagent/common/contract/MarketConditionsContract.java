package com.tradeagent.common.contract;

import com.tradeagent.common.session.SessionPhase;
import com.tradeagent.common.session.VolatilityRegime;

/**
 * Builds {@link MarketConditions}. The no-trade-zone reason is the first matching rule:
 * <ol>
 *   <li>low volatility on a sideways trend</li>
 *   <li>expiry day</li>
 *   <li>major scheduled event</li>
 * </ol>
 */
public final class MarketConditionsContract {

    private MarketConditionsContract() {}

    public static MarketConditions build(SessionPhase phase, VolatilityRegime regime,
                                         boolean sidewaysTrend, boolean expiryDay, boolean majorEvent) {
        SessionPhase p = phase != null ? phase : SessionPhase.CLOSED;
        VolatilityRegime r = regime != null ? regime : VolatilityRegime.UNKNOWN;
        return new MarketConditions(p.label(), r.label(), expiryDay, majorEvent,
            noTradeZone(r, sidewaysTrend, expiryDay, majorEvent));
    }

    static String noTradeZone(VolatilityRegime regime, boolean sideways, boolean expiryDay, boolean majorEvent) {
        if (regime == VolatilityRegime.LOW && sideways) return "Low volatility + sideways market";
        if (expiryDay)  return "Expiry day volatility";
        if (majorEvent) return "Major event risk";
        return null;
    }
}
