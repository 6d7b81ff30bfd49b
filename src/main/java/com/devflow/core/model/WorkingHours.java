package com.devflow.core.model;

/**
 * Configured working window. {@code start} and {@code end} are zero-padded "HH:MM" strings
 * compared lexicographically against local time in {@code timezone}.
 */
public record WorkingHours(
    String start,
    String end,
    String timezone
) {}
