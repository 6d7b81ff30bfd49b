package com.devflow.core.llm;

/**
 * Raw completion returned by a provider.
 *
 * @param content text content, possibly blank
 * @param usage   token accounting, {@link TokenUsage#none()} when the provider does not report it
 * @param model   model that produced the completion, may be {@code null}
 */
public record LlmResponse(String content, TokenUsage usage, String model) {

    public LlmResponse {
        usage = usage == null ? TokenUsage.none() : usage;
    }
}
