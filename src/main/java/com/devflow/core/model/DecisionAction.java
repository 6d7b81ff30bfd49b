package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Actions the decision agent may choose.
 */
public enum DecisionAction {
    COMMIT,
    BRANCH,
    PR,
    STASH,
    CHECKPOINT,
    SUGGEST,
    WAIT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the lower-case wire value.
     *
     * @throws IllegalArgumentException for unknown or blank values
     */
    @JsonCreator
    public static DecisionAction fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Decision action is missing");
        }
        for (DecisionAction action : values()) {
            if (action.value().equalsIgnoreCase(value.trim())) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown decision action: " + value);
    }
}
