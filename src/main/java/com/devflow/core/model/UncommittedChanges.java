package com.devflow.core.model;

import java.util.List;

/**
 * Working tree changes reported by the git collaborator.
 *
 * @param fileCount    number of changed files
 * @param diffSummary  short textual diff summary
 * @param filesChanged per-file status entries
 */
public record UncommittedChanges(
    int fileCount,
    String diffSummary,
    List<FileChange> filesChanged
) {

    public UncommittedChanges {
        diffSummary = diffSummary == null ? "" : diffSummary;
        filesChanged = filesChanged == null ? List.of() : List.copyOf(filesChanged);
    }

    public boolean hasStatus(FileStatus status) {
        return filesChanged.stream().anyMatch(f -> f.status() == status);
    }
}
