package com.devflow.core.model;

/**
 * Payload of a {@link MonitoringEventType#FILE_CHANGE} event.
 *
 * @param filePath   path of the changed file, as reported by the file watcher
 * @param changeType watcher event kind, e.g. "add", "change", "unlink"
 */
public record FileChangePayload(
    String filePath,
    String changeType
) implements EventPayload {}
