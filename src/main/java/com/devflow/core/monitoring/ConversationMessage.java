package com.devflow.core.monitoring;

import java.time.Instant;

public record ConversationMessage(
    String content,
    String role,
    Instant timestamp
) {}
