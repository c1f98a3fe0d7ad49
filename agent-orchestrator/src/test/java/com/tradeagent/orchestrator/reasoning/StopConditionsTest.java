package com.tradeagent.orchestrator.reasoning;

import com.tradeagent.orchestrator.config.LoopSettings;
import com.tradeagent.orchestrator.tool.RegistryMode;
import com.tradeagent.orchestrator.tool.ToolResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class StopConditionsTest {

    private static final LoopSettings SETTINGS = LoopSettings.defaults();

    private static LoopState afterSteps(int steps, String content) {
        LoopState state = LoopState.initial("goal", RegistryMode.ALERT, SETTINGS, Clock.systemUTC());
        for (int i = 0; i < steps; i++) {
            state = state.appendModelResponse(ParsedResponse.text(content, null, "stop"));
        }
        return state;
    }

    @Test
    @DisplayName("final answer stops first")
    void finalAnswer() {
        LoopState state = afterSteps(1, "done");
        StopDecision decision = StopConditions.evaluate(state, ParsedResponse.finalAnswer("done", 0.1), SETTINGS);
        assertTrue(decision.stop());
        assertEquals("Final answer provided", decision.reason());
    }

    @Test
    @DisplayName("confidence below the threshold stops")
    void lowConfidence() {
        LoopState state = afterSteps(1, "meh");
        StopDecision decision = StopConditions.evaluate(state, ParsedResponse.text("meh", 0.2, "stop"), SETTINGS);
        assertTrue(decision.stop());
        assertEquals("Confidence too low (0.2)", decision.reason());
    }

    @Test
    @DisplayName("confidence at the threshold does not stop")
    void thresholdConfidence() {
        LoopState state = afterSteps(1, "ok");
        assertFalse(StopConditions.evaluate(state, ParsedResponse.text("ok", 0.3, "stop"), SETTINGS).stop());
    }

    @Test
    @DisplayName("five tool errors stop")
    void toolErrors() {
        LoopState state = afterSteps(1, "x");
        for (int i = 0; i < 5; i++) {
            state = state.appendToolResult("t", ToolResult.failure("e"), false);
        }
        StopDecision decision = StopConditions.evaluate(state, ParsedResponse.text("x", null, "stop"), SETTINGS);
        assertTrue(decision.stop());
        assertEquals("Too many tool errors (5)", decision.reason());
    }

    @Test
    @DisplayName("below the soft limit the loop proceeds")
    void proceeds() {
        LoopState state = afterSteps(2, "x");
        assertFalse(StopConditions.evaluate(state, ParsedResponse.text("x", null, "stop"), SETTINGS).stop());
    }

    @Test
    @DisplayName("soft step limit stops without a continuation request")
    void softLimit() {
        LoopState state = afterSteps(3, "x");
        StopDecision decision = StopConditions.evaluate(state, ParsedResponse.text("x", null, "stop"), SETTINGS);
        assertEquals("Step limit reached (3 steps)", decision.reason());
    }

    @Test
    @DisplayName("a continuation request extends past the soft limit up to the hard limit")
    void continuation() {
        ParsedResponse wantsMore = ParsedResponse.text("I need more data", null, "stop");
        assertFalse(StopConditions.evaluate(afterSteps(3, "I need more data"), wantsMore, SETTINGS).stop());
        assertFalse(StopConditions.evaluate(afterSteps(4, "I need more data"), wantsMore, SETTINGS).stop());

        StopDecision decision = StopConditions.evaluate(afterSteps(5, "I need more data"), wantsMore, SETTINGS);
        assertEquals("Extended step limit reached (5 steps)", decision.reason());
    }
}
