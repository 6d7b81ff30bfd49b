package com.devflow.core.model;

import java.util.List;

/**
 * Payload of a {@link MonitoringEventType#FILES_MENTIONED} event.
 * Paths are de-duplicated and kept in first-mention order.
 */
public record FilesMentionedPayload(
    List<String> files,
    String message,
    String role
) implements EventPayload {

    public FilesMentionedPayload {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
