package com.devflow.core.model;

/**
 * Payload of a {@link MonitoringEventType#GIT_STATE_CHANGE} event.
 *
 * @param branch             current branch name
 * @param uncommittedChanges working tree changes, or {@code null} when the tree is clean
 * @param latestCommit       most recent commit, or {@code null} for an empty repository
 */
public record GitStatePayload(
    String branch,
    UncommittedChanges uncommittedChanges,
    Commit latestCommit
) implements EventPayload {

    public int uncommittedFileCount() {
        return uncommittedChanges != null ? uncommittedChanges.fileCount() : 0;
    }
}
