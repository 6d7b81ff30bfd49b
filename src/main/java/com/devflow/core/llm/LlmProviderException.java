package com.devflow.core.llm;

/**
 * Thrown when a completion provider fails to produce a response.
 */
public class LlmProviderException extends RuntimeException {
    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
