package com.devflow.core.monitoring;

import java.time.Instant;

/**
 * A debounced file change reported by the {@link FileWatcher}.
 *
 * @param eventType watcher event kind, e.g. "add", "change", "unlink"
 */
public record FileChangeEvent(
    String projectPath,
    String filePath,
    String eventType,
    Instant timestamp
) {}
