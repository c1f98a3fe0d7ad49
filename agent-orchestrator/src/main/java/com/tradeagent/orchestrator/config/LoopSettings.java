package com.tradeagent.orchestrator.config;

/**
 * Bounds of one reasoning loop, built once at startup.
 *
 * @param maxSteps       soft step limit
 * @param extraSteps     steps granted beyond the soft limit when the model asks to continue
 * @param maxToolErrors  accumulated tool failures that end the loop
 * @param minConfidence  model-reported confidence below which the loop ends
 * @param maxHistory     conversation messages retained in state
 * @param maxMemory      tool results retained in state
 * @param promptHistory  history messages replayed to the model each step
 * @param promptMemory   tool results summarised in the user prompt
 */
public record LoopSettings(
    int maxSteps,
    int extraSteps,
    int maxToolErrors,
    double minConfidence,
    int maxHistory,
    int maxMemory,
    int promptHistory,
    int promptMemory
) {
    public static LoopSettings defaults() {
        return new LoopSettings(3, 2, 5, 0.3, 10, 50, 6, 5);
    }

    public LoopSettings withSteps(int maxSteps, int extraSteps) {
        return new LoopSettings(maxSteps, extraSteps, maxToolErrors, minConfidence,
                                maxHistory, maxMemory, promptHistory, promptMemory);
    }

    public int hardStepLimit() {
        return maxSteps + extraSteps;
    }
}
