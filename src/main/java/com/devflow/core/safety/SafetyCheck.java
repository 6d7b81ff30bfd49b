package com.devflow.core.safety;

import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.LlmDecision;

import java.util.Optional;

/**
 * One predicate of the safety gate. A present finding forces approval.
 */
@FunctionalInterface
public interface SafetyCheck {

    Optional<SafetyFinding> evaluate(LlmDecision decision, DecisionContext context);
}
