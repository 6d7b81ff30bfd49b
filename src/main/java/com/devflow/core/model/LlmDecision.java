package com.devflow.core.model;

import java.util.List;

/**
 * Gated action decision produced by the decision agent.
 * <p>
 * Confidence is clamped to [0, 1] on construction, whatever the model returned.
 *
 * @param action             chosen action
 * @param confidence         confidence in [0, 1]
 * @param reasoning          explanation, extended by safety notes
 * @param requiresApproval   whether a human must approve before execution
 * @param alternativeActions other viable actions named by the model
 * @param riskAssessment     optional risk details, may be {@code null}
 */
public record LlmDecision(
    DecisionAction action,
    double confidence,
    String reasoning,
    boolean requiresApproval,
    List<String> alternativeActions,
    RiskAssessment riskAssessment
) {

    public LlmDecision {
        confidence = clamp(confidence);
        reasoning = reasoning == null ? "" : reasoning;
        alternativeActions = alternativeActions == null ? List.of() : List.copyOf(alternativeActions);
    }

    public LlmDecision(DecisionAction action, double confidence, String reasoning, boolean requiresApproval) {
        this(action, confidence, reasoning, requiresApproval, List.of(), null);
    }

    /**
     * The decision returned whenever anything in the decision path fails.
     */
    public static LlmDecision safeDefault(String errorMessage) {
        return new LlmDecision(DecisionAction.WAIT, 0.0, "Error occurred: " + errorMessage, true);
    }

    public LlmDecision withAction(DecisionAction newAction) {
        return new LlmDecision(newAction, confidence, reasoning, requiresApproval, alternativeActions, riskAssessment);
    }

    public LlmDecision withConfidence(double newConfidence) {
        return new LlmDecision(action, newConfidence, reasoning, requiresApproval, alternativeActions, riskAssessment);
    }

    public LlmDecision withReasoning(String newReasoning) {
        return new LlmDecision(action, confidence, newReasoning, requiresApproval, alternativeActions, riskAssessment);
    }

    public LlmDecision withRequiresApproval(boolean newRequiresApproval) {
        return new LlmDecision(action, confidence, reasoning, newRequiresApproval, alternativeActions, riskAssessment);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
