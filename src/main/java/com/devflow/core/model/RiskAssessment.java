package com.devflow.core.model;

import java.util.List;

/**
 * Risk evaluation of a proposed action.
 *
 * @param score            0 (safe) to 1 (critical)
 * @param factors          contributing factors
 * @param level            bucketed level
 * @param requiresApproval whether a human must approve
 */
public record RiskAssessment(
    double score,
    List<String> factors,
    RiskLevel level,
    boolean requiresApproval
) {

    public RiskAssessment {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }

    /** Returned when the model's assessment cannot be parsed. */
    public static RiskAssessment unassessable() {
        return new RiskAssessment(1.0, List.of("Failed to assess risk"), RiskLevel.CRITICAL, true);
    }
}
