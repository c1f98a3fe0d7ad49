package com.tradeagent.common.exception;

/**
 * Tool arguments failed schema validation. The message is returned to the model verbatim
 * so it can retry with corrected arguments.
 */
public class ToolValidationException extends AgentException {

    private final String detail;

    public ToolValidationException(String toolName, String detail) {
        super(toolName, detail);
        this.detail = detail;
    }

    /** Validation message without the component prefix. */
    public String getDetail() {
        return detail;
    }
}
