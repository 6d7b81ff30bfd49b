package com.devflow.core.model;

/**
 * Payload of the LLM automation events (requested, made, approval required, executed, failed, feedback).
 *
 * @param decisionId   tracking id, {@code null} before a decision exists
 * @param decision     the decision, {@code null} for {@link MonitoringEventType#LLM_DECISION_REQUESTED}
 * @param triggerType  type of the event that triggered the decision loop
 */
public record DecisionPayload(
    String decisionId,
    LlmDecision decision,
    MonitoringEventType triggerType
) implements EventPayload {}
