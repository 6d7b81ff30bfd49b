package com.devflow.core.learning;

import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.LlmDecision;

/**
 * Partial override of a decision. {@code null} fields leave the original value in place.
 */
public record DecisionAdjustment(
    DecisionAction action,
    Double confidence,
    Boolean requiresApproval
) {

    public LlmDecision applyTo(LlmDecision decision) {
        LlmDecision adjusted = decision;
        if (action != null) {
            adjusted = adjusted.withAction(action);
        }
        if (confidence != null) {
            adjusted = adjusted.withConfidence(confidence);
        }
        if (requiresApproval != null) {
            adjusted = adjusted.withRequiresApproval(requiresApproval);
        }
        return adjusted;
    }
}
