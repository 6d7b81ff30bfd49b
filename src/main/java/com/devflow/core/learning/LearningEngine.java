package com.devflow.core.learning;

import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.LlmDecision;

/**
 * Learns from past decisions and user feedback.
 * <p>
 * Consulted by the decision agent before the safety gate whenever
 * {@code devflow.automation.learning.enabled} is set.
 */
public interface LearningEngine {

    /**
     * Judges a freshly parsed decision against learned patterns.
     */
    LearningInsights analyzeDecision(LlmDecision decision, DecisionContext context);

    /**
     * @return the confidence to use for {@code decision}, in [0, 1]
     */
    double adjustConfidence(LlmDecision decision, DecisionContext context);
}
