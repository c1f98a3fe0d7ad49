package com.tradeagent.common.model;

/**
 * Build status of a timeframe context.
 *
 * <p>Only {@link #COMPLETE} can ever open a gate; {@link #NO_DATA} and {@link #ERROR}
 * always close it.
 */
public enum ContextStatus {
    COMPLETE,
    NO_DATA,
    ERROR;

    public boolean isComplete() {
        return this == COMPLETE;
    }
}
