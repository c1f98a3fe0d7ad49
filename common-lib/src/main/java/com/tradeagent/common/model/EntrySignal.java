package com.tradeagent.common.model;

public enum EntrySignal {
    CONFIRMED,
    FORMING,
    NOT_CONFIRMED
}
