package com.tradeagent.common.contract;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Session and event flags attached to the brief. {@code noTradeZone} is {@code null} when no
 * rule fires.
 */
public record MarketConditions(
    @JsonProperty("sessionPhase") String sessionPhase,
    @JsonProperty("volatilityRegime") String volatilityRegime,
    @JsonProperty("expiryDay") boolean expiryDay,
    @JsonProperty("majorEvent") boolean majorEvent,
    @JsonProperty("noTradeZone") String noTradeZone
) {}
