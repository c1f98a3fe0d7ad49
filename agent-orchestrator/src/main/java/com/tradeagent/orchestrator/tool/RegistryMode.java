package com.tradeagent.orchestrator.tool;

/**
 * Safety mode of a {@link ToolRegistry}.
 *
 * <ul>
 *   <li>ALERT: read-only; execution tools are refused</li>
 *   <li>LIVE:  execution tools are enabled</li>
 * </ul>
 */
public enum RegistryMode {
    ALERT,
    LIVE;

    public static RegistryMode fromConfig(String value) {
        return "live".equalsIgnoreCase(value) ? LIVE : ALERT;
    }
}
