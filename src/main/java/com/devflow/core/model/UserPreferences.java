package com.devflow.core.model;

/**
 * User preferences forwarded into decision prompts.
 *
 * @param workingHours {@code null} when no working window is configured
 */
public record UserPreferences(
    String commitStyle,
    String commitFrequency,
    WorkingHours workingHours,
    String riskTolerance
) {

    public static UserPreferences defaults() {
        return new UserPreferences("conventional", "moderate", null, "medium");
    }
}
