package com.tradeagent.common.trace;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Minimal run tracing. Every pipeline run gets a short run id which is bridged into the
 * SLF4J MDC under {@link #TRACE_ID_KEY} while the run executes.
 */
public final class TraceContextUtil {

    public static final String TRACE_ID_KEY = "traceId";

    private TraceContextUtil() {}

    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Runs {@code action} with {@code traceId} in MDC, restoring whatever was there before.
     */
    public static <T> T callWithMdc(String traceId, Supplier<T> action) {
        String previous = MDC.get(TRACE_ID_KEY);
        MDC.put(TRACE_ID_KEY, traceId);
        try {
            return action.get();
        } finally {
            if (previous == null) MDC.remove(TRACE_ID_KEY);
            else MDC.put(TRACE_ID_KEY, previous);
        }
    }
}
