package com.tradeagent.common.model;

public enum TriggerType {
    RANGE_BREAK,
    VWAP_RECLAIM,
    MOMENTUM_BURST,
    NONE
}
