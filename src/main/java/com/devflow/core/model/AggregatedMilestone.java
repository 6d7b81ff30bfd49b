package com.devflow.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A higher-level accomplishment inferred from a correlated set of events.
 *
 * @param type        milestone rule that fired
 * @param events      exactly the events that satisfied the rule, in arrival order
 * @param timestamp   timestamp of the event whose insertion fired the rule
 * @param title       short title
 * @param description longer description
 */
public record AggregatedMilestone(
    MilestoneType type,
    List<MonitoringEvent> events,
    Instant timestamp,
    String title,
    String description
) {

    public AggregatedMilestone {
        events = List.copyOf(events);
    }
}
