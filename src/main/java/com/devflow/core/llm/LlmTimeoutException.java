package com.devflow.core.llm;

/**
 * Thrown when a provider call or a test check exceeds its time bound.
 */
public class LlmTimeoutException extends RuntimeException {
    public LlmTimeoutException(String message) {
        super(message);
    }

    public LlmTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
