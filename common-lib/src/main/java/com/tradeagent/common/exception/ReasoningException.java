package com.tradeagent.common.exception;

/**
 * Language-model endpoint unreachable or returned something unusable. Never fatal: the
 * caller falls back to the deterministic recommendation.
 */
public class ReasoningException extends AgentException {

    public ReasoningException(String component, String message) {
        super(component, message);
    }

    public ReasoningException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
