package com.tradeagent.orchestrator.reasoning;

import com.tradeagent.orchestrator.config.LoopSettings;

import java.util.regex.Pattern;

/**
 * Pure stop evaluation over the state after the latest reply has been applied. Checked in order:
 * <ol>
 *   <li>the reply is a final answer</li>
 *   <li>reported confidence is below {@link LoopSettings#minConfidence()}</li>
 *   <li>accumulated tool errors reached {@link LoopSettings#maxToolErrors()}</li>
 *   <li>the soft step limit is reached and the reply does not ask to continue;
 *       the hard limit ({@code maxSteps + extraSteps}) stops regardless</li>
 * </ol>
 */
public final class StopConditions {

    static final Pattern CONTINUATION = Pattern.compile("continue|need more|still missing|one more",
                                                        Pattern.CASE_INSENSITIVE);

    private StopConditions() {}

    public static StopDecision evaluate(LoopState state, ParsedResponse latest, LoopSettings settings) {
        if (latest != null && latest.isFinal()) {
            return StopDecision.stop("Final answer provided");
        }
        if (latest != null && latest.confidence() != null && latest.confidence() < settings.minConfidence()) {
            return StopDecision.stop("Confidence too low (" + latest.confidence() + ")");
        }
        if (state.toolErrorCount() >= settings.maxToolErrors()) {
            return StopDecision.stop("Too many tool errors (" + state.toolErrorCount() + ")");
        }
        if (state.stepCount() >= settings.hardStepLimit()) {
            return StopDecision.stop("Extended step limit reached (" + settings.hardStepLimit() + " steps)");
        }
        if (state.stepCount() >= settings.maxSteps()) {
            boolean wantsMore = latest != null && CONTINUATION.matcher(latest.content()).find();
            if (!wantsMore) {
                return StopDecision.stop("Step limit reached (" + settings.maxSteps() + " steps)");
            }
        }
        return StopDecision.proceed();
    }
}
