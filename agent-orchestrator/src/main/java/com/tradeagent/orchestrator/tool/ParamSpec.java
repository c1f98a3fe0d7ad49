package com.tradeagent.orchestrator.tool;

/** Declared parameter of a tool. */
public record ParamSpec(ParamType type, boolean required, String description) {

    public static ParamSpec required(ParamType type, String description) {
        return new ParamSpec(type, true, description);
    }

    public static ParamSpec optional(ParamType type, String description) {
        return new ParamSpec(type, false, description);
    }
}
