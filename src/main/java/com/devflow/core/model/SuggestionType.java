package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SuggestionType {
    COMMIT,
    BRANCH,
    CHECKPOINT,
    PR,
    WARNING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
