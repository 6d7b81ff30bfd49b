package com.devflow.core.monitoring;

import com.devflow.core.model.MonitoringEventType;

import java.util.Map;

/**
 * Counts over the aggregator's retained buffer. Hour and day windows are measured
 * back from the newest retained event.
 */
public record EventStats(
    int totalEvents,
    int eventsLastHour,
    int eventsLastDay,
    Map<MonitoringEventType, Integer> eventTypes
) {

    public EventStats {
        eventTypes = Map.copyOf(eventTypes);
    }

    public static EventStats empty() {
        return new EventStats(0, 0, 0, Map.of());
    }
}
