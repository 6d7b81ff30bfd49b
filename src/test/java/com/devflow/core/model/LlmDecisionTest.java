package com.devflow.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link LlmDecision} and {@link DecisionAction}.
 */
class LlmDecisionTest {

    @ParameterizedTest(name = "{0} clamps to {1}")
    @CsvSource({"1.7, 1.0", "-0.3, 0.0", "0.42, 0.42", "0, 0.0", "1, 1.0"})
    @DisplayName("confidence is clamped into [0, 1]")
    void clampsConfidence(double raw, double expected) {
        var decision = new LlmDecision(DecisionAction.COMMIT, raw, "r", false);

        assertEquals(expected, decision.confidence(), 1e-9);
    }

    @Test
    @DisplayName("NaN confidence becomes zero")
    void nanBecomesZero() {
        assertEquals(0.0, new LlmDecision(DecisionAction.COMMIT, Double.NaN, "r", false).confidence());
    }

    @Test
    @DisplayName("safe default waits, needs approval and reports the error")
    void safeDefault() {
        var decision = LlmDecision.safeDefault("provider down");

        assertEquals(DecisionAction.WAIT, decision.action());
        assertEquals(0.0, decision.confidence());
        assertTrue(decision.requiresApproval());
        assertEquals("Error occurred: provider down", decision.reasoning());
    }

    @Test
    @DisplayName("decision actions parse case-insensitively and reject unknown values")
    void parsesActions() {
        assertEquals(DecisionAction.PR, DecisionAction.fromValue("PR"));
        assertEquals(DecisionAction.CHECKPOINT, DecisionAction.fromValue(" checkpoint "));
        assertThrows(IllegalArgumentException.class, () -> DecisionAction.fromValue("deploy"));
        assertThrows(IllegalArgumentException.class, () -> DecisionAction.fromValue(""));
    }
}
