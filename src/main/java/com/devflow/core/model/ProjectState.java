package com.devflow.core.model;

import java.time.Instant;

/**
 * Project snapshot handed to the decision agent.
 *
 * @param branch             current branch
 * @param isProtected        whether the branch is protected
 * @param uncommittedChanges number of uncommitted files
 * @param lastCommitTime     time of the most recent commit, {@code null} if unknown
 * @param testStatus         last known test status
 * @param buildStatus        last known build status
 */
public record ProjectState(
    String branch,
    boolean isProtected,
    int uncommittedChanges,
    Instant lastCommitTime,
    TestStatus testStatus,
    BuildStatus buildStatus
) {

    public ProjectState {
        testStatus = testStatus == null ? TestStatus.UNKNOWN : testStatus;
        buildStatus = buildStatus == null ? BuildStatus.UNKNOWN : buildStatus;
    }
}
