package com.tradeagent.orchestrator.reasoning;

public enum ResponseType {
    TOOL_CALL,
    TEXT,
    FINAL
}
