package com.devflow.core.monitoring;

import com.devflow.core.config.MonitoringProperties;
import com.devflow.core.events.EventChannel;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.AggregatedMilestone;
import com.devflow.core.model.GitStatePayload;
import com.devflow.core.model.MilestoneType;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.MonitoringEventType;
import com.devflow.core.model.MonitoringSuggestion;
import com.devflow.core.model.MonitoringSuggestionType;
import com.devflow.core.model.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Correlates monitoring events into milestones and event-driven suggestions.
 * <p>
 * Events are kept in a bounded buffer in arrival order. All windows and cooldowns are
 * measured on event timestamps, never on wall-clock time, so replaying the same event
 * sequence into a fresh aggregator yields the same milestones and suggestions.
 * Milestone rules only look at events of the project of the event just added.
 */
@Service
public class EventAggregator {

    private static final Logger log = LoggerFactory.getLogger(EventAggregator.class);

    private static final Duration BUG_FIX_WINDOW = Duration.ofHours(24);
    private static final int RELEASE_FEATURE_COUNT = 3;

    private final int maxEvents;
    private final Duration milestoneWindow;
    private final Duration suggestionCooldown;
    private final int commitThreshold;
    private final DevflowMetrics metrics;

    private final ArrayDeque<BufferedEvent> buffer = new ArrayDeque<>();
    private final Map<String, Instant> lastSuggestionAt = new HashMap<>();
    private final LinkedHashSet<String> firedMilestones = new LinkedHashSet<>();
    private long sequence;

    private final EventChannel<AggregatedMilestone> milestones =
            new EventChannel<>("milestones", m -> m.events().get(m.events().size() - 1).projectPath());
    private final EventChannel<MonitoringSuggestion> suggestions =
            new EventChannel<>("monitoring-suggestions",
                    s -> s.relatedEvents().isEmpty() ? null : s.relatedEvents().get(0).projectPath());

    @Autowired
    public EventAggregator(MonitoringProperties properties, DevflowMetrics metrics) {
        this(properties.getMaxBufferedEvents(),
                Duration.ofMinutes(properties.getMilestoneWindowMinutes()),
                Duration.ofMinutes(properties.getSuggestionCooldownMinutes()),
                properties.getCommitThreshold(),
                metrics);
    }

    public EventAggregator(int maxEvents, Duration milestoneWindow, Duration suggestionCooldown,
                           int commitThreshold, DevflowMetrics metrics) {
        this.maxEvents = maxEvents;
        this.milestoneWindow = milestoneWindow;
        this.suggestionCooldown = suggestionCooldown;
        this.commitThreshold = commitThreshold;
        this.metrics = metrics;
    }

    public EventChannel<AggregatedMilestone> milestones() {
        return milestones;
    }

    public EventChannel<MonitoringSuggestion> suggestions() {
        return suggestions;
    }

    /**
     * Buffers the event, then evaluates milestone and suggestion rules against it.
     * Subscribers are notified before this method returns.
     */
    public synchronized void addEvent(MonitoringEvent event) {
        buffer.addLast(new BufferedEvent(++sequence, event));
        while (buffer.size() > maxEvents) {
            buffer.removeFirst();
        }
        log.debug("Buffered {} for {} ({} retained)", event.type().value(), event.projectPath(), buffer.size());

        if (event.type().isLlmEvent()) {
            return;
        }
        checkForMilestones(event);
        generateSuggestion(event);
    }

    // ---- Milestones ----

    private void checkForMilestones(MonitoringEvent latest) {
        List<BufferedEvent> window = projectEventsSince(latest.projectPath(), latest.timestamp().minus(milestoneWindow));

        Optional<BufferedEvent> tests = lastOfType(window, MonitoringEventType.TESTS_PASSING);
        Optional<BufferedEvent> docs = lastOfType(window, MonitoringEventType.DOCS_UPDATED);
        Optional<BufferedEvent> feature = lastOfType(window, MonitoringEventType.FEATURE_COMPLETE);
        if (tests.isPresent() && docs.isPresent() && feature.isPresent()) {
            fire(MilestoneType.FEATURE_SHIPPED, List.of(tests.get(), docs.get(), feature.get()), latest,
                    "Feature Complete with Tests and Documentation",
                    "A feature has been implemented with tests passing and documentation updated.");
        }

        List<BufferedEvent> features = ofType(window, MonitoringEventType.FEATURE_COMPLETE);
        List<BufferedEvent> bugFixes = ofType(window, MonitoringEventType.BUG_FIXED);
        List<BufferedEvent> passing = ofType(window, MonitoringEventType.TESTS_PASSING);
        String releaseDescription = features.size() + " features completed, " + bugFixes.size()
                + " bugs fixed. Consider creating a release.";

        if (features.size() >= RELEASE_FEATURE_COUNT) {
            fire(MilestoneType.RELEASE_READY, lastN(features, RELEASE_FEATURE_COUNT), latest,
                    "Multiple Features Ready for Release", releaseDescription);
        } else if (!features.isEmpty() && bugFixes.size() >= 2 && !passing.isEmpty()) {
            List<BufferedEvent> members = new ArrayList<>(lastN(features, 1));
            members.addAll(lastN(bugFixes, 2));
            members.addAll(lastN(passing, 1));
            fire(MilestoneType.RELEASE_READY, members, latest,
                    "Features and Fixes Ready for Release", releaseDescription);
        }
    }

    private void fire(MilestoneType type, List<BufferedEvent> members, MonitoringEvent trigger,
                      String title, String description) {
        List<BufferedEvent> ordered = members.stream()
                .sorted(Comparator.comparingLong(BufferedEvent::sequence))
                .toList();
        String key = type.name() + ":" + ordered.stream()
                .map(b -> Long.toString(b.sequence()))
                .collect(Collectors.joining(","));
        if (!firedMilestones.add(key)) {
            return;
        }
        trimFiredMilestones();

        AggregatedMilestone milestone = new AggregatedMilestone(type,
                ordered.stream().map(BufferedEvent::event).toList(),
                trigger.timestamp(), title, description);
        log.info("Milestone {} reached for {}", type.value(), trigger.projectPath());
        metrics.recordMilestone(type);
        milestones.publish(milestone);
    }

    private void trimFiredMilestones() {
        Iterator<String> oldest = firedMilestones.iterator();
        while (firedMilestones.size() > maxEvents && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    // ---- Event-driven suggestions ----

    private void generateSuggestion(MonitoringEvent event) {
        MonitoringSuggestion suggestion = switch (event.type()) {
            case FEATURE_COMPLETE -> suggestion(MonitoringSuggestionType.COMMIT, Priority.HIGH,
                    "Feature completed! Time to commit your changes.", "dev_checkpoint",
                    "Committing completed features keeps a clean rollback point.", List.of(event));
            case TESTS_FAILING -> suggestion(MonitoringSuggestionType.FIX, Priority.HIGH,
                    "Tests are failing. Focus on fixing them before continuing.", null,
                    "Failing tests hide regressions.", List.of(event));
            case BUG_FIXED -> releaseAfterBugFixes(event);
            case READY_FOR_RELEASE -> suggestion(MonitoringSuggestionType.RELEASE, Priority.HIGH,
                    "Project is ready for release!", "dev_release",
                    "Release readiness was mentioned in conversation.", List.of(event));
            case BLOCKED -> suggestion(MonitoringSuggestionType.HELP, Priority.HIGH,
                    "You seem to be blocked. Consider creating an issue or asking for help.", "dev_issue_create",
                    "Blocked work was mentioned in conversation.", List.of(event));
            case GIT_STATE_CHANGE -> largeChangeset(event);
            default -> null;
        };
        if (suggestion == null) {
            return;
        }

        String cooldownKey = event.type().value() + "|" + event.projectPath();
        Instant last = lastSuggestionAt.get(cooldownKey);
        if (last != null && event.timestamp().isBefore(last.plus(suggestionCooldown))) {
            log.debug("Suppressing {} suggestion for {} (cooldown)", suggestion.type().value(), event.projectPath());
            return;
        }
        lastSuggestionAt.put(cooldownKey, event.timestamp());
        metrics.recordMonitoringSuggestion(suggestion.type());
        suggestions.publish(suggestion);
    }

    private MonitoringSuggestion releaseAfterBugFixes(MonitoringEvent event) {
        List<MonitoringEvent> recentFixes = ofType(
                projectEventsSince(event.projectPath(), event.timestamp().minus(BUG_FIX_WINDOW)),
                MonitoringEventType.BUG_FIXED).stream().map(BufferedEvent::event).toList();
        if (recentFixes.size() < 3) {
            return null;
        }
        return suggestion(MonitoringSuggestionType.RELEASE, Priority.MEDIUM,
                "Multiple bugs fixed. Consider creating a patch release.", "dev_release",
                recentFixes.size() + " bug fixes in the last 24 hours.", recentFixes);
    }

    private MonitoringSuggestion largeChangeset(MonitoringEvent event) {
        int fileCount = event.payloadAs(GitStatePayload.class).uncommittedFileCount();
        if (fileCount < commitThreshold) {
            return null;
        }
        return suggestion(MonitoringSuggestionType.COMMIT, Priority.MEDIUM,
                "You have " + fileCount + " uncommitted files. Consider breaking them into smaller commits.",
                "dev_checkpoint", "Smaller commits are easier to review and revert.", List.of(event));
    }

    private static MonitoringSuggestion suggestion(MonitoringSuggestionType type, Priority priority, String message,
                                                   String action, String reason, List<MonitoringEvent> related) {
        return new MonitoringSuggestion(type, priority, message, action, reason, related);
    }

    // ---- Queries ----

    public synchronized EventStats getStats() {
        if (buffer.isEmpty()) {
            return EventStats.empty();
        }
        Instant newest = buffer.stream().map(b -> b.event().timestamp()).max(Comparator.naturalOrder()).orElseThrow();
        Instant hourAgo = newest.minus(Duration.ofHours(1));
        Instant dayAgo = newest.minus(Duration.ofDays(1));

        int lastHour = 0;
        int lastDay = 0;
        Map<MonitoringEventType, Integer> types = new EnumMap<>(MonitoringEventType.class);
        for (BufferedEvent buffered : buffer) {
            Instant ts = buffered.event().timestamp();
            if (!ts.isBefore(hourAgo)) {
                lastHour++;
            }
            if (!ts.isBefore(dayAgo)) {
                lastDay++;
            }
            types.merge(buffered.event().type(), 1, Integer::sum);
        }
        return new EventStats(buffer.size(), lastHour, lastDay, types);
    }

    /**
     * @return the last {@code count} buffered events, oldest first
     */
    public synchronized List<MonitoringEvent> getRecentEvents(int count) {
        return tail(buffer.stream().map(BufferedEvent::event).toList(), count);
    }

    /**
     * @return the last {@code count} buffered events of one project, oldest first
     */
    public synchronized List<MonitoringEvent> getRecentEvents(String projectPath, int count) {
        return tail(buffer.stream()
                .map(BufferedEvent::event)
                .filter(e -> e.projectPath().equals(projectPath))
                .toList(), count);
    }

    /** Drops all buffered events, cooldowns, milestone history and subscribers. */
    public synchronized void clear() {
        buffer.clear();
        lastSuggestionAt.clear();
        firedMilestones.clear();
        sequence = 0;
        milestones.clear();
        suggestions.clear();
    }

    // ---- Helpers ----

    private List<BufferedEvent> projectEventsSince(String projectPath, Instant since) {
        return buffer.stream()
                .filter(b -> b.event().projectPath().equals(projectPath))
                .filter(b -> !b.event().timestamp().isBefore(since))
                .toList();
    }

    private static List<BufferedEvent> ofType(List<BufferedEvent> events, MonitoringEventType type) {
        return events.stream().filter(b -> b.event().type() == type).toList();
    }

    private static Optional<BufferedEvent> lastOfType(List<BufferedEvent> events, MonitoringEventType type) {
        List<BufferedEvent> matching = ofType(events, type);
        return matching.isEmpty() ? Optional.empty() : Optional.of(matching.get(matching.size() - 1));
    }

    private static <T> List<T> lastN(List<T> items, int n) {
        return items.subList(Math.max(0, items.size() - n), items.size());
    }

    private static <T> List<T> tail(List<T> items, int count) {
        return List.copyOf(lastN(items, Math.max(0, count)));
    }

    /** An event tagged with its arrival sequence number. */
    private record BufferedEvent(long sequence, MonitoringEvent event) {}
}
