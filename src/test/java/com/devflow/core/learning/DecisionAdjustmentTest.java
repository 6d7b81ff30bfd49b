package com.devflow.core.learning;

import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.LlmDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionAdjustmentTest {

    private final LlmDecision original = new LlmDecision(DecisionAction.COMMIT, 0.8, "done", false,
            List.of("wait"), null);

    @Test
    @DisplayName("null fields keep the original values")
    void emptyAdjustment() {
        assertEquals(original, new DecisionAdjustment(null, null, null).applyTo(original));
    }

    @Test
    @DisplayName("set fields override and the rest is kept")
    void partialAdjustment() {
        LlmDecision adjusted = new DecisionAdjustment(DecisionAction.CHECKPOINT, 1.4, true).applyTo(original);

        assertEquals(DecisionAction.CHECKPOINT, adjusted.action());
        assertEquals(1.0, adjusted.confidence());
        assertTrue(adjusted.requiresApproval());
        assertEquals("done", adjusted.reasoning());
        assertEquals(List.of("wait"), adjusted.alternativeActions());
    }

    @Test
    @DisplayName("insights join their reasons")
    void joinedReasoning() {
        var insights = new LearningInsights(true, List.of("late commits", "small diffs"), null);

        assertEquals("late commits; small diffs", insights.joinedReasoning());
        assertTrue(LearningInsights.proceed().shouldProceed());
    }
}
