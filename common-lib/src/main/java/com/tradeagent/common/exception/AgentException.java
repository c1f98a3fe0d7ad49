package com.tradeagent.common.exception;

/**
 * Root of the agent's unchecked error taxonomy. Messages are prefixed with the component
 * that raised them, e.g. {@code "[DhanHQ] HTTP 401"}.
 */
public class AgentException extends RuntimeException {

    private final String component;

    public AgentException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AgentException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
