package com.tradeagent.common.exception;

/** Missing or invalid required setting. Fatal at startup. */
public class ConfigurationException extends AgentException {

    public ConfigurationException(String message) {
        super("Config", message);
    }
}
