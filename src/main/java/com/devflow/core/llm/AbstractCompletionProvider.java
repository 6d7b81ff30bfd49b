package com.devflow.core.llm;

import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.RiskAssessment;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared decision parsing for completion providers.
 * <p>
 * A valid decision needs a known {@code action}, a numeric {@code confidence} and a
 * non-blank {@code reasoning}. Confidence outside [0, 1] is clamped rather than rejected.
 */
public abstract class AbstractCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractCompletionProvider.class);

    protected final LlmJsonParser jsonParser;

    protected AbstractCompletionProvider(LlmJsonParser jsonParser) {
        this.jsonParser = jsonParser;
    }

    @Override
    public LlmDecision parseDecision(String content) {
        JsonNode node = jsonParser.readObject(content)
                .orElseThrow(() -> new LlmParseException("Failed to parse LLM response as JSON"));

        JsonNode action = node.get("action");
        JsonNode confidence = node.get("confidence");
        JsonNode reasoning = node.get("reasoning");
        if (action == null || !action.isTextual() || action.asText().isBlank()) {
            throw new LlmParseException("Invalid decision format from LLM: missing action");
        }
        if (confidence == null || !confidence.isNumber()) {
            throw new LlmParseException("Invalid decision format from LLM: confidence must be a number");
        }
        if (reasoning == null || !reasoning.isTextual() || reasoning.asText().isBlank()) {
            throw new LlmParseException("Invalid decision format from LLM: missing reasoning");
        }

        DecisionAction decisionAction;
        try {
            decisionAction = DecisionAction.fromValue(action.asText());
        } catch (IllegalArgumentException e) {
            throw new LlmParseException("Invalid decision format from LLM: " + e.getMessage(), e);
        }

        JsonNode approval = node.get("requiresApproval");
        boolean requiresApproval = approval != null && approval.asBoolean(false);

        return new LlmDecision(decisionAction, confidence.asDouble(), reasoning.asText(), requiresApproval,
                readAlternatives(node.get("alternativeActions")), readRisk(node.get("riskAssessment")));
    }

    private static List<String> readAlternatives(JsonNode node) {
        List<String> alternatives = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual()) {
                    alternatives.add(item.asText());
                }
            });
        }
        return alternatives;
    }

    private RiskAssessment readRisk(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return jsonParser.convert(node, RiskAssessment.class);
        } catch (LlmParseException e) {
            log.debug("Ignoring malformed risk assessment in decision: {}", e.getMessage());
            return null;
        }
    }
}
