package com.devflow.core.suggestion;

import com.devflow.core.model.DevelopmentStatus;

import java.time.Instant;

/**
 * Per-project session timing used by time-based suggestions.
 * <p>
 * {@code uncommittedStartTime} is set exactly while the last observed status had
 * uncommitted files: armed on the first dirty observation, cleared on the first clean one.
 */
public class WorkContext {

    private final Instant sessionStartTime;
    private Instant lastCommitTime;
    private Instant lastStatusCheckTime;
    private Instant uncommittedStartTime;

    public WorkContext(Instant sessionStartTime) {
        this.sessionStartTime = sessionStartTime;
    }

    synchronized void observe(DevelopmentStatus status, Instant now) {
        lastStatusCheckTime = now;
        if (status.hasUncommittedChanges()) {
            if (uncommittedStartTime == null) {
                uncommittedStartTime = now;
            }
        } else {
            if (uncommittedStartTime != null) {
                lastCommitTime = now;
            }
            uncommittedStartTime = null;
        }
    }

    public Instant getSessionStartTime() {
        return sessionStartTime;
    }

    public synchronized Instant getLastCommitTime() {
        return lastCommitTime;
    }

    public synchronized Instant getLastStatusCheckTime() {
        return lastStatusCheckTime;
    }

    public synchronized Instant getUncommittedStartTime() {
        return uncommittedStartTime;
    }
}
