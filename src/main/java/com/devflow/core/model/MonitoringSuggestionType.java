package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of suggestion emitted directly from the event stream.
 */
public enum MonitoringSuggestionType {
    COMMIT,
    BRANCH,
    RELEASE,
    PR,
    FIX,
    HELP;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
