package com.devflow.core.model;

public record PrDescription(
    String title,
    String body
) {}
