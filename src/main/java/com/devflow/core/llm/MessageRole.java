package com.devflow.core.llm;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
