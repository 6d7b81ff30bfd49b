package com.devflow.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MilestoneType {
    FEATURE_SHIPPED,
    RELEASE_READY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
