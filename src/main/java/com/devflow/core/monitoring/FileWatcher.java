package com.devflow.core.monitoring;

import com.devflow.core.events.Subscription;

import java.util.function.Consumer;

/**
 * Source of debounced file change notifications. Bursts are coalesced by the implementation.
 */
public interface FileWatcher {

    Subscription addChangeListener(Consumer<FileChangeEvent> listener);
}
