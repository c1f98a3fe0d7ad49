package com.tradeagent.common.model;

/** CE = call, PE = put. */
public enum OptionType {
    CE,
    PE
}
