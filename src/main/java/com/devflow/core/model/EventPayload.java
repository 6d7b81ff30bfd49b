package com.devflow.core.model;

/**
 * Marker for the per-type payload carried by a {@link MonitoringEvent}.
 * <p>
 * Every {@link MonitoringEventType} is bound to exactly one payload record class,
 * checked when the event is constructed.
 */
public interface EventPayload {
}
