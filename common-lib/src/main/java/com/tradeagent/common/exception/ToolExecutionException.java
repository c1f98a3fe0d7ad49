package com.tradeagent.common.exception;

/** Raised by tool handlers; the registry converts it into a failed tool result. */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String toolName, String message) {
        super(toolName, message);
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(toolName, message, cause);
    }
}
