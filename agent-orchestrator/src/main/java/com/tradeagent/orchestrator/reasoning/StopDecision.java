package com.tradeagent.orchestrator.reasoning;

public record StopDecision(boolean stop, String reason) {

    private static final StopDecision PROCEED = new StopDecision(false, null);

    public static StopDecision proceed() {
        return PROCEED;
    }

    public static StopDecision stop(String reason) {
        return new StopDecision(true, reason);
    }
}
