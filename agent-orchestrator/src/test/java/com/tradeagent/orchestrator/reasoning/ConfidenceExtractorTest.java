package com.tradeagent.orchestrator.reasoning;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceExtractorTest {

    @Test
    @DisplayName("reads decimal, percent and JSON forms")
    void forms() {
        assertEquals(0.72, ConfidenceExtractor.extract("Confidence: 0.72 on the long side"), 1e-9);
        assertEquals(0.72, ConfidenceExtractor.extract("confidence 72"), 1e-9);
        assertEquals(0.8, ConfidenceExtractor.extract("{\"decision\":\"ENTER\",\"confidence\": 0.8}"), 1e-9);
        assertEquals(0.65, ConfidenceExtractor.extract("confidence=0.65"), 1e-9);
    }

    @Test
    @DisplayName("ratios are divided by their own scale")
    void ratios() {
        assertEquals(0.8, ConfidenceExtractor.extract("Confidence: 8/10"), 1e-9);
        assertEquals(0.7, ConfidenceExtractor.extract("confidence 7 out of 10, trend intact"), 1e-9);
        assertEquals(0.85, ConfidenceExtractor.extract("confidence: 85 / 100"), 1e-9);
        assertEquals(0.6, ConfidenceExtractor.extract("Confidence 3/5"), 1e-9);
    }

    @Test
    @DisplayName("missing or out-of-range values give null")
    void absent() {
        assertNull(ConfidenceExtractor.extract("no figure here"));
        assertNull(ConfidenceExtractor.extract(""));
        assertNull(ConfidenceExtractor.extract(null));
        assertNull(ConfidenceExtractor.extract("confidence: 150"));
        assertNull(ConfidenceExtractor.extract("confidence: 12/10"));
        assertNull(ConfidenceExtractor.extract("confidence: 8/0"));
    }
}
