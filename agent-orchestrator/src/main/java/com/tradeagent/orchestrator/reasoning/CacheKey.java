package com.tradeagent.orchestrator.reasoning;

/**
 * Identity of a tool call for result reuse: tool name plus the canonical JSON of its
 * arguments (sorted keys, trimmed keys, alphanumeric strings upper-cased).
 */
public record CacheKey(String toolName, String canonicalArgs) {

    @Override
    public String toString() {
        return toolName + ":" + canonicalArgs;
    }
}
