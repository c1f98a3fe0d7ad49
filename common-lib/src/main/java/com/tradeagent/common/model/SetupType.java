package com.tradeagent.common.model;

public enum SetupType {
    PULLBACK,
    BREAKOUT,
    TREND_CONTINUATION,
    NONE
}
