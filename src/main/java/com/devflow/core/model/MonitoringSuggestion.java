package com.devflow.core.model;

import java.util.List;

/**
 * Suggestion emitted by the event aggregator in direct response to events.
 *
 * @param action         dev action to run, {@code null} for advisory suggestions
 * @param relatedEvents  events that caused the suggestion
 */
public record MonitoringSuggestion(
    MonitoringSuggestionType type,
    Priority priority,
    String message,
    String action,
    String reason,
    List<MonitoringEvent> relatedEvents
) {

    public MonitoringSuggestion {
        relatedEvents = relatedEvents == null ? List.of() : List.copyOf(relatedEvents);
    }
}
