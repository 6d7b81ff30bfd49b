package com.devflow.core.model;

/**
 * Payload for event types that carry nothing beyond a short detail string
 * (commit created, branch created/switched, command executed, error discussed).
 */
public record NotePayload(String detail) implements EventPayload {}
