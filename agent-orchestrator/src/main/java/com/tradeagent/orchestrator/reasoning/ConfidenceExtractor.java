package com.tradeagent.orchestrator.reasoning;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a self-reported confidence out of free text: {@code "confidence: 0.72"},
 * {@code "Confidence 72"}, {@code "confidence: 8/10"}, {@code "confidence 7 out of 10"} or
 * {@code "\"confidence\": 0.8"}. A ratio is divided out first; any other value above 1 is read
 * as percent.
 */
public final class ConfidenceExtractor {

    private static final Pattern CONFIDENCE = Pattern.compile(
        "confidence[\"'\\s:=]+(\\d+(?:\\.\\d+)?)(?:\\s*(?:/|out\\s+of)\\s*(\\d+(?:\\.\\d+)?))?",
        Pattern.CASE_INSENSITIVE);

    private ConfidenceExtractor() {}

    /** @return confidence in [0, 1], or {@code null} when none is stated or it is out of range */
    public static Double extract(String text) {
        if (text == null || text.isEmpty()) return null;
        Matcher m = CONFIDENCE.matcher(text);
        if (!m.find()) return null;
        double value = Double.parseDouble(m.group(1));
        if (m.group(2) != null) {
            double scale = Double.parseDouble(m.group(2));
            if (scale <= 0.0) return null;
            value = value / scale;
        } else if (value > 1.0) {
            value = value / 100.0;
        }
        return value >= 0.0 && value <= 1.0 ? value : null;
    }
}
