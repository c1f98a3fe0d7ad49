package com.tradeagent.orchestrator.tool;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ToolRegistryTest {

    private final AtomicInteger orderCalls = new AtomicInteger();

    private ToolRegistry registry(RegistryMode mode) {
        return new ToolRegistry(mode)
            .register("echo", "Echo the message",
                Map.of("message", ParamSpec.required(ParamType.STRING, "text"),
                       "times", ParamSpec.optional(ParamType.INTEGER, "repeat count")),
                args -> Map.of("echo", args.get("message")))
            .register("explode", "Always fails", Map.of(),
                args -> { throw new IllegalStateException("boom"); })
            .register("send_order", "Execution tool",
                Map.of("qty", ParamSpec.required(ParamType.INTEGER, "lots")),
                ToolCategory.EXECUTION,
                args -> { orderCalls.incrementAndGet(); return "sent"; });
    }

    @BeforeEach
    void reset() {
        orderCalls.set(0);
    }

    @Nested
    @DisplayName("execute()")
    class ExecuteTests {

        @Test
        @DisplayName("valid call wraps handler output in a successful result")
        void success() {
            ToolResult result = registry(RegistryMode.ALERT).execute("echo", Map.of("message", "hi"));
            assertTrue(result.success());
            assertEquals(Map.of("echo", "hi"), result.data());
            assertNull(result.error());
        }

        @Test
        @DisplayName("unknown tool is reported, not thrown")
        void unknownTool() {
            ToolResult result = registry(RegistryMode.ALERT).execute("nope", Map.of());
            assertFalse(result.success());
            assertEquals("Tool 'nope' not found", result.error());
        }

        @Test
        @DisplayName("missing required parameter fails validation")
        void missingRequired() {
            ToolResult result = registry(RegistryMode.ALERT).execute("echo", Map.of());
            assertFalse(result.success());
            assertEquals("Invalid arguments: Missing required parameter: message", result.error());
        }

        @Test
        @DisplayName("wrong parameter type fails validation")
        void wrongType() {
            ToolResult result = registry(RegistryMode.ALERT).execute("echo", Map.of("message", "x", "times", "two"));
            assertFalse(result.success());
            assertEquals("Invalid arguments: Parameter times must be a integer", result.error());
        }

        @Test
        @DisplayName("null arguments are treated as empty")
        void nullArgs() {
            ToolResult result = registry(RegistryMode.ALERT).execute("explode", null);
            assertFalse(result.success());
            assertEquals("boom", result.error());
        }

        @Test
        @DisplayName("handler exception becomes a failed result")
        void handlerThrows() {
            ToolResult result = registry(RegistryMode.ALERT).execute("explode", Map.of());
            assertFalse(result.success());
            assertEquals("boom", result.error());
        }
    }

    @Nested
    @DisplayName("safety mode")
    class SafetyModeTests {

        @Test
        @DisplayName("execution tool is refused in alert mode without invoking the handler")
        void alertRefuses() {
            ToolResult result = registry(RegistryMode.ALERT).execute("send_order", Map.of("qty", 1));
            assertFalse(result.success());
            assertEquals("Tool 'send_order' is disabled in alert mode", result.error());
            assertEquals(0, orderCalls.get());
        }

        @Test
        @DisplayName("execution tool runs in live mode")
        void liveRuns() {
            ToolResult result = registry(RegistryMode.LIVE).execute("send_order", Map.of("qty", 1));
            assertTrue(result.success());
            assertEquals("sent", result.data());
            assertEquals(1, orderCalls.get());
        }

        @Test
        @DisplayName("alert mode hides execution tools from the schema")
        void schemaFiltered() {
            ToolRegistry alert = registry(RegistryMode.ALERT);
            assertEquals(List.of("echo", "explode"), List.copyOf(alert.enabledToolNames()));
            assertEquals(2, alert.toSchema().size());
            assertEquals(3, registry(RegistryMode.LIVE).toSchema().size());
        }
    }

    @Nested
    @DisplayName("toSchema()")
    class SchemaTests {

        @Test
        @DisplayName("descriptor lists properties and required parameters")
        @SuppressWarnings("unchecked")
        void descriptorShape() {
            Map<String, Object> descriptor = registry(RegistryMode.ALERT).toSchema().get(0);
            assertEquals("function", descriptor.get("type"));

            Map<String, Object> function = (Map<String, Object>) descriptor.get("function");
            assertEquals("echo", function.get("name"));

            Map<String, Object> parameters = (Map<String, Object>) function.get("parameters");
            assertEquals("object", parameters.get("type"));
            assertEquals(List.of("message"), parameters.get("required"));

            Map<String, Object> properties = (Map<String, Object>) parameters.get("properties");
            assertEquals("integer", ((Map<String, Object>) properties.get("times")).get("type"));
        }
    }

    @Test
    @DisplayName("ParamType.matches follows JSON decoding")
    void paramTypes() {
        assertTrue(ParamType.NUMBER.matches(3));
        assertTrue(ParamType.NUMBER.matches(2.5));
        assertFalse(ParamType.INTEGER.matches(2.5));
        assertTrue(ParamType.ARRAY.matches(List.of()));
        assertTrue(ParamType.OBJECT.matches(Map.of()));
        assertFalse(ParamType.STRING.matches(7));
    }
}
