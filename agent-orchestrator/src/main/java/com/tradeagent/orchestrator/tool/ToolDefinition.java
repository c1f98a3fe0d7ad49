package com.tradeagent.orchestrator.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A registered tool: name, description, parameter schema, category and handler.
 */
public record ToolDefinition(
    String name,
    String description,
    Map<String, ParamSpec> parameters,
    ToolCategory category,
    ToolHandler handler
) {
    public ToolDefinition {
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public boolean enabledIn(RegistryMode mode) {
        return category == ToolCategory.ANALYSIS || mode == RegistryMode.LIVE;
    }

    /**
     * Function descriptor in the shape the chat endpoint expects:
     * <pre>
     * {type:"function", function:{name, description, parameters:{type:"object", properties, required}}}
     * </pre>
     */
    public Map<String, Object> toSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        parameters.forEach((param, spec) -> {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", spec.type().schemaName());
            if (spec.description() != null) property.put("description", spec.description());
            properties.put(param, property);
            if (spec.required()) required.add(param);
        });

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);

        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("description", description);
        function.put("parameters", schema);

        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("type", "function");
        descriptor.put("function", function);
        return descriptor;
    }
}
