package com.devflow.core.monitoring;

import com.devflow.core.config.MonitoringProperties;
import com.devflow.core.events.EventChannel;
import com.devflow.core.model.ConversationPayload;
import com.devflow.core.model.FilesMentionedPayload;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.MonitoringEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Turns narrated conversation text into monitoring events.
 * <p>
 * Each message is matched against the pattern table; a category fires at most once per
 * message. Mentioned files are reported in a separate {@link MonitoringEventType#FILES_MENTIONED}
 * event. Emitted events carry an empty project path; {@link MonitorManager} attributes them.
 */
@Service
public class ConversationMonitor {

    private static final Logger log = LoggerFactory.getLogger(ConversationMonitor.class);

    private final List<ConversationPattern> patterns;
    private final int maxMessages;
    private final Clock clock;
    private final ArrayDeque<ConversationMessage> messages = new ArrayDeque<>();
    private final EventChannel<MonitoringEvent> events =
            new EventChannel<>("conversation-events", MonitoringEvent::projectPath);

    private volatile boolean running = true;

    @Autowired
    public ConversationMonitor(MonitoringProperties properties, Clock clock) {
        this(ConversationPatterns.DEFAULT, properties.getMaxBufferedMessages(), clock);
    }

    public ConversationMonitor(List<ConversationPattern> patterns, int maxMessages, Clock clock) {
        this.patterns = List.copyOf(patterns);
        this.maxMessages = maxMessages;
        this.clock = clock;
    }

    public EventChannel<MonitoringEvent> events() {
        return events;
    }

    /**
     * Analyzes one message and publishes the resulting events.
     *
     * @return the events emitted for this message, empty when stopped
     */
    public List<MonitoringEvent> processMessage(String content, String role) {
        if (!running || content == null) {
            return List.of();
        }
        Instant now = clock.instant();

        synchronized (messages) {
            messages.addLast(new ConversationMessage(content, role, now));
            while (messages.size() > maxMessages) {
                messages.removeFirst();
            }
        }

        List<MonitoringEvent> emitted = analyze(content, role, now);
        if (!emitted.isEmpty()) {
            log.debug("Conversation message from {} produced {} event(s)", role, emitted.size());
        }
        for (MonitoringEvent event : emitted) {
            events.publish(event);
        }
        return emitted;
    }

    private List<MonitoringEvent> analyze(String content, String role, Instant now) {
        List<MonitoringEvent> result = new ArrayList<>();
        Set<MonitoringEventType> fired = EnumSet.noneOf(MonitoringEventType.class);

        for (ConversationPattern pattern : patterns) {
            if (!fired.contains(pattern.eventType()) && pattern.matches(content)) {
                fired.add(pattern.eventType());
                ConversationPayload payload = new ConversationPayload(content, role, pattern.name(), pattern.priority());
                result.add(MonitoringEvent.conversation(pattern.eventType(), "", payload, now));
            }
        }

        List<String> files = FileMentionExtractor.extract(content);
        if (!files.isEmpty()) {
            result.add(MonitoringEvent.filesMentioned("", new FilesMentionedPayload(files, content, role), now));
        }
        return result;
    }

    /**
     * @return the last {@code count} messages, oldest first
     */
    public List<ConversationMessage> getRecentContext(int count) {
        synchronized (messages) {
            List<ConversationMessage> all = new ArrayList<>(messages);
            int from = Math.max(0, all.size() - Math.max(0, count));
            return List.copyOf(all.subList(from, all.size()));
        }
    }

    public boolean isActive() {
        return running;
    }

    /** Resumes emission after {@link #stop()}. A new monitor is already running. */
    public void start() {
        if (!running) {
            log.info("Starting conversation monitor");
        }
        running = true;
    }

    /** Stops emission, clears the buffer and drops subscribers until {@link #start()}. Idempotent. */
    public void stop() {
        if (running) {
            log.info("Stopping conversation monitor");
        }
        running = false;
        synchronized (messages) {
            messages.clear();
        }
        events.clear();
    }
}
