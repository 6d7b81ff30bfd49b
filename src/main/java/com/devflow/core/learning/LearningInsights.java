package com.devflow.core.learning;

import java.util.List;

/**
 * Verdict of the learning engine on a decision.
 *
 * @param shouldProceed    false to veto the decision in favour of waiting
 * @param reasoning        human-readable reasons, joined with "; " in decision text
 * @param adjustedDecision field overrides to merge into the decision, {@code null} for none
 */
public record LearningInsights(
    boolean shouldProceed,
    List<String> reasoning,
    DecisionAdjustment adjustedDecision
) {

    public LearningInsights {
        reasoning = reasoning == null ? List.of() : List.copyOf(reasoning);
    }

    public String joinedReasoning() {
        return String.join("; ", reasoning);
    }

    public static LearningInsights proceed() {
        return new LearningInsights(true, List.of(), null);
    }
}
