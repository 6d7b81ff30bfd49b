package com.devflow.core.model;

/**
 * Working tree status of a single changed file.
 */
public enum FileStatus {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED
}
