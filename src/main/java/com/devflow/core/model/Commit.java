package com.devflow.core.model;

import java.time.Instant;

public record Commit(
    String hash,
    String message,
    String author,
    Instant date
) {}
