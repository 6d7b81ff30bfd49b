package com.devflow.core.model;

public record FileChange(
    String file,
    FileStatus status
) {}
