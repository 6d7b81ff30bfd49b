package com.devflow.core.model;

/**
 * Actionable recommendation produced by a suggestion pass.
 *
 * @param type       suggestion kind
 * @param priority   urgency
 * @param message    user-facing message
 * @param action     dev action to run, {@code null} for advisory notes
 * @param reason     why the suggestion was made, may be {@code null}
 * @param fromLlm    whether the suggestion came from the decision agent
 * @param confidence model confidence in [0, 1], {@code null} for rule-based suggestions
 */
public record Suggestion(
    SuggestionType type,
    Priority priority,
    String message,
    String action,
    String reason,
    boolean fromLlm,
    Double confidence
) {

    public static Suggestion rule(SuggestionType type, Priority priority, String message,
                                  String action, String reason) {
        return new Suggestion(type, priority, message, action, reason, false, null);
    }

    /** Deduplication key: type plus action. */
    public String key() {
        return type.value() + "-" + action;
    }

    public double confidenceOrZero() {
        return confidence != null ? confidence : 0.0;
    }
}
