package com.tradeagent.orchestrator.tool;

import com.tradeagent.common.exception.ToolValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Catalog of callable tools for one reasoning run.
 *
 * <p>{@link #execute} never throws. Every outcome is a {@link ToolResult}:
 * <ul>
 *   <li>unknown tool → {@code "Tool 'x' not found"}</li>
 *   <li>execution tool in {@link RegistryMode#ALERT} → {@code "Tool 'x' is disabled in alert mode"},
 *       handler not invoked</li>
 *   <li>schema violation → {@code "Invalid arguments: ..."}</li>
 *   <li>handler exception → its message</li>
 * </ul>
 *
 * <p>One instance per run; not shared between runs.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final RegistryMode mode;
    private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();

    public ToolRegistry(RegistryMode mode) {
        this.mode = mode != null ? mode : RegistryMode.ALERT;
    }

    public RegistryMode mode() {
        return mode;
    }

    /** Registers an analysis tool. */
    public ToolRegistry register(String name, String description, Map<String, ParamSpec> parameters,
                                 ToolHandler handler) {
        return register(name, description, parameters, ToolCategory.ANALYSIS, handler);
    }

    public ToolRegistry register(String name, String description, Map<String, ParamSpec> parameters,
                                 ToolCategory category, ToolHandler handler) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("tool name is required");
        if (handler == null) throw new IllegalArgumentException("handler is required for tool " + name);
        tools.put(name, new ToolDefinition(name, description, parameters, category, handler));
        return this;
    }

    public ToolResult execute(String name, Map<String, Object> args) {
        ToolDefinition tool = tools.get(name);
        if (tool == null) {
            log.warn("[ToolRegistry] Unknown tool requested. tool={}", name);
            return ToolResult.failure("Tool '" + name + "' not found");
        }
        if (!tool.enabledIn(mode)) {
            log.warn("[ToolRegistry] Execution tool refused. tool={} mode={}", name, mode);
            return ToolResult.failure("Tool '" + name + "' is disabled in alert mode");
        }

        Map<String, Object> arguments = args != null ? args : Map.of();
        try {
            validate(tool, arguments);
        } catch (ToolValidationException e) {
            log.info("[ToolRegistry] Invalid arguments. tool={} detail={}", name, e.getDetail());
            return ToolResult.failure("Invalid arguments: " + e.getDetail());
        }

        try {
            Object output = tool.handler().handle(arguments);
            if (output instanceof ToolResult result) return result;
            log.debug("[ToolRegistry] Tool executed. tool={}", name);
            return ToolResult.ok(output);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("[ToolRegistry] Tool failed. tool={} error={}", name, message);
            return ToolResult.failure(message);
        }
    }

    static void validate(ToolDefinition tool, Map<String, Object> args) {
        for (Map.Entry<String, ParamSpec> entry : tool.parameters().entrySet()) {
            String param = entry.getKey();
            ParamSpec spec = entry.getValue();
            Object value = args.get(param);
            if (value == null) {
                if (spec.required()) {
                    throw new ToolValidationException(tool.name(), "Missing required parameter: " + param);
                }
                continue;
            }
            if (!spec.type().matches(value)) {
                throw new ToolValidationException(tool.name(),
                    "Parameter " + param + " must be a " + spec.type().schemaName());
            }
        }
    }

    /** Descriptors of the tools enabled in the current mode. */
    public List<Map<String, Object>> toSchema() {
        return tools.values().stream()
            .filter(t -> t.enabledIn(mode))
            .map(ToolDefinition::toSchema)
            .toList();
    }

    public Set<String> enabledToolNames() {
        return tools.values().stream()
            .filter(t -> t.enabledIn(mode))
            .map(ToolDefinition::name)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public List<ToolDefinition> enabledTools() {
        return tools.values().stream().filter(t -> t.enabledIn(mode)).toList();
    }
}
