package com.devflow.core.model;

/**
 * Payload of events detected in narrated conversation text.
 *
 * @param message  the full message that matched
 * @param role     "user" or "assistant"
 * @param pattern  name of the catalog pattern that fired
 * @param priority priority attached to the pattern
 */
public record ConversationPayload(
    String message,
    String role,
    String pattern,
    Priority priority
) implements EventPayload {}
