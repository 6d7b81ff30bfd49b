package com.devflow.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A discrete observation about project activity: a file change, a git state change,
 * or something detected in conversation text.
 *
 * @param type        event kind
 * @param timestamp   when the observation was made
 * @param projectPath project the event belongs to; empty until attributed by the monitor manager
 * @param description short human-readable summary
 * @param payload     typed payload, must be an instance of {@link MonitoringEventType#payloadType()}
 * @param files       files the event concerns, possibly empty
 */
public record MonitoringEvent(
    MonitoringEventType type,
    Instant timestamp,
    String projectPath,
    String description,
    EventPayload payload,
    List<String> files
) {

    public MonitoringEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payload, "payload");
        if (!type.payloadType().isInstance(payload)) {
            throw new IllegalArgumentException("Event " + type + " requires payload "
                    + type.payloadType().getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
        projectPath = projectPath == null ? "" : projectPath;
        description = description == null ? "" : description;
        files = files == null ? List.of() : List.copyOf(files);
    }

    public MonitoringEvent withProjectPath(String newProjectPath) {
        return new MonitoringEvent(type, timestamp, newProjectPath, description, payload, files);
    }

    /**
     * Returns the payload cast to its declared record type.
     */
    public <P extends EventPayload> P payloadAs(Class<P> payloadClass) {
        return payloadClass.cast(payload);
    }

    public static MonitoringEvent fileChange(String projectPath, String filePath, String changeType, Instant at) {
        return new MonitoringEvent(MonitoringEventType.FILE_CHANGE, at, projectPath,
                "File " + changeType + ": " + filePath,
                new FileChangePayload(filePath, changeType), List.of(filePath));
    }

    public static MonitoringEvent gitStateChange(String projectPath, String branch,
                                                 UncommittedChanges changes, Commit latestCommit, Instant at) {
        List<String> files = changes == null ? List.of()
                : changes.filesChanged().stream().map(FileChange::file).toList();
        int count = changes == null ? 0 : changes.fileCount();
        return new MonitoringEvent(MonitoringEventType.GIT_STATE_CHANGE, at, projectPath,
                "Branch " + branch + " with " + count + " uncommitted file(s)",
                new GitStatePayload(branch, changes, latestCommit), files);
    }

    public static MonitoringEvent conversation(MonitoringEventType type, String projectPath,
                                               ConversationPayload payload, Instant at) {
        return new MonitoringEvent(type, at, projectPath, payload.pattern(), payload, List.of());
    }

    public static MonitoringEvent filesMentioned(String projectPath, FilesMentionedPayload payload, Instant at) {
        return new MonitoringEvent(MonitoringEventType.FILES_MENTIONED, at, projectPath,
                payload.files().size() + " file(s) mentioned", payload, payload.files());
    }

    public static MonitoringEvent decision(MonitoringEventType type, String projectPath,
                                           DecisionPayload payload, Instant at) {
        String description = payload.decision() != null
                ? payload.decision().action().value() + " (" + payload.decision().reasoning() + ")"
                : "Decision requested for " + payload.triggerType().value();
        return new MonitoringEvent(type, at, projectPath, description, payload, List.of());
    }
}
