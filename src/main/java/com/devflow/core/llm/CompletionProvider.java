package com.devflow.core.llm;

import com.devflow.core.model.LlmDecision;

import java.util.List;

/**
 * Text completion backend used by the decision agent.
 * <p>
 * {@link #complete} may block for an unbounded time; callers bound it with a timeout.
 */
public interface CompletionProvider {

    /**
     * @throws LlmProviderException on transport or provider failure
     */
    LlmResponse complete(List<LlmMessage> messages);

    /**
     * Parses a structured decision out of raw completion text.
     *
     * @throws LlmParseException when the text holds no valid decision
     */
    LlmDecision parseDecision(String content);

    boolean isAvailable();

    String getName();
}
