package com.devflow.core.llm;

/**
 * Thrown when the LLM returns null or blank content.
 */
public class LlmEmptyResponseException extends RuntimeException {
    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
