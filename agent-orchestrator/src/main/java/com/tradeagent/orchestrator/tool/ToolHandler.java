package com.tradeagent.orchestrator.tool;

import java.util.Map;

/**
 * Body of a tool. Receives arguments already validated against the declared schema.
 * Anything thrown is converted into a failed {@link ToolResult} by the registry.
 */
@FunctionalInterface
public interface ToolHandler {

    Object handle(Map<String, Object> args) throws Exception;
}
