package com.devflow.core.model;

/**
 * Snapshot of a project's git status as passed into a suggestion pass.
 *
 * @param branch             current branch
 * @param isProtected        whether the branch is configured as protected
 * @param uncommittedChanges working tree changes, {@code null} when clean
 */
public record DevelopmentStatus(
    String branch,
    boolean isProtected,
    UncommittedChanges uncommittedChanges
) {

    public int uncommittedFileCount() {
        return uncommittedChanges != null ? uncommittedChanges.fileCount() : 0;
    }

    public boolean hasUncommittedChanges() {
        return uncommittedFileCount() > 0;
    }
}
