package com.devflow.core.git;

import com.devflow.core.model.Commit;
import com.devflow.core.model.UncommittedChanges;

import java.util.List;
import java.util.Optional;

/**
 * Read-only git status primitives supplied by the git command layer.
 * <p>
 * Implementations may block for an unbounded time and may throw
 * {@link GitStatusException}; callers in the pipeline log and skip on failure.
 */
public interface GitStatusProvider {

    String getCurrentBranch(String projectPath);

    /**
     * @return the working tree changes, or empty when the tree is clean
     */
    Optional<UncommittedChanges> getUncommittedChanges(String projectPath);

    /**
     * @return up to {@code limit} most recent commits, newest first
     */
    List<Commit> getRecentCommits(String projectPath, int limit);
}
