package com.tradeagent.orchestrator.tool;

public enum ToolCategory {
    /** Always enabled. */
    ANALYSIS,
    /** Enabled only in {@link RegistryMode#LIVE}. */
    EXECUTION
}
