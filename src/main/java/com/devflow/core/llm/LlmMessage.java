package com.devflow.core.llm;

/**
 * One chat message sent to a completion provider.
 */
public record LlmMessage(MessageRole role, String content) {

    public static LlmMessage system(String content) {
        return new LlmMessage(MessageRole.SYSTEM, content);
    }

    public static LlmMessage user(String content) {
        return new LlmMessage(MessageRole.USER, content);
    }
}
