package com.devflow.core.monitoring;

import com.devflow.core.config.MonitoringProperties;
import com.devflow.core.model.MonitoringEvent;

import java.util.List;

/**
 * Snapshot of the monitoring pipeline for external status surfaces.
 */
public record MonitoringState(
    List<MonitoringProperties.Project> projects,
    ActiveMonitors activeMonitors,
    EventStats eventStats,
    List<MonitoringEvent> lastEvents
) {

    public record ActiveMonitors(
        boolean fileWatcher,
        boolean gitMonitor,
        boolean conversationMonitor
    ) {}
}
