package com.tradeagent.orchestrator.reasoning;

/**
 * Where one loop iteration ended up after the model replied.
 */
public enum LoopPhase {
    AWAITING_MODEL,
    TOOL_CALL,
    TEXT_CONTINUE,
    FINAL_ANSWER
}
