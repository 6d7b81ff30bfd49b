package com.devflow.core.model;

/**
 * Published by the aggregator's decision loop when a decision needs approval
 * or is confident enough to be executed.
 */
public record DecisionNotice(
    String decisionId,
    LlmDecision decision,
    DecisionContext context
) {}
