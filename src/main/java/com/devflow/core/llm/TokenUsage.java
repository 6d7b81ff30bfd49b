package com.devflow.core.llm;

public record TokenUsage(int promptTokens, int completionTokens, int totalTokens) {

    public static TokenUsage none() {
        return new TokenUsage(0, 0, 0);
    }
}
