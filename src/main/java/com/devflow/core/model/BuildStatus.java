package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BuildStatus {
    SUCCESS,
    FAILING,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
