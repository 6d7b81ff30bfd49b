package com.devflow.core.monitoring;

import com.devflow.core.model.MonitoringEventType;
import com.devflow.core.model.Priority;

import java.util.regex.Pattern;

/**
 * One row of the conversation pattern table.
 *
 * @param name      pattern name carried in the event payload
 * @param regex     case-insensitive phrase matcher, searched anywhere in the message
 * @param eventType event emitted on a match
 * @param priority  priority attached to the emitted event
 */
public record ConversationPattern(
    String name,
    Pattern regex,
    MonitoringEventType eventType,
    Priority priority
) {

    public static ConversationPattern of(String name, String regex,
                                         MonitoringEventType eventType, Priority priority) {
        return new ConversationPattern(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), eventType, priority);
    }

    public boolean matches(String message) {
        return regex.matcher(message).find();
    }
}
