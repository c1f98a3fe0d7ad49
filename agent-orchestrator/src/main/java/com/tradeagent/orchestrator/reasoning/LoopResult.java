package com.tradeagent.orchestrator.reasoning;

import java.util.List;

/**
 * Outcome of a reasoning loop. {@code success=false} only when the model could not be
 * reached or answered with something unusable; stop conditions still count as success.
 */
public record LoopResult(
    boolean success,
    String answer,
    int steps,
    String stopReason,
    List<MemoryEntry> memory,
    String error
) {
    public LoopResult {
        memory = memory == null ? List.of() : List.copyOf(memory);
    }

    public static LoopResult completed(String answer, int steps, String stopReason, List<MemoryEntry> memory) {
        return new LoopResult(true, answer, steps, stopReason, memory, null);
    }

    public static LoopResult failed(String error, int steps, List<MemoryEntry> memory) {
        return new LoopResult(false, null, steps, "Model failure", memory, error);
    }
}
