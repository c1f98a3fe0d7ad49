package com.tradeagent.common.exception;

/**
 * Broker fetch failure (transport, timeout, non-2xx, unparseable body). Fails the
 * current gate only.
 */
public class DataSourceException extends AgentException {

    public DataSourceException(String source, String message) {
        super(source, message);
    }

    public DataSourceException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
