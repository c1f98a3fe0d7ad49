package com.tradeagent.orchestrator.tool;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * The closed set of parameter types a tool may declare, named as in JSON Schema.
 */
public enum ParamType {

    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    ARRAY("array"),
    OBJECT("object");

    private final String schemaName;

    ParamType(String schemaName) {
        this.schemaName = schemaName;
    }

    public String schemaName() {
        return schemaName;
    }

    /** True when {@code value} (as decoded by Jackson) is an instance of this type. */
    public boolean matches(Object value) {
        return switch (this) {
            case STRING  -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long || value instanceof Short
                         || value instanceof Byte || value instanceof BigInteger;
            case NUMBER  -> value instanceof Number;
            case ARRAY   -> value instanceof List<?> || (value != null && value.getClass().isArray());
            case OBJECT  -> value instanceof Map<?, ?>;
        };
    }
}
