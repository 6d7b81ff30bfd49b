package com.devflow.core.monitoring;

import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.AggregatedMilestone;
import com.devflow.core.model.ConversationPayload;
import com.devflow.core.model.DecisionPayload;
import com.devflow.core.model.FileChange;
import com.devflow.core.model.FileStatus;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.MilestoneType;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.MonitoringEventType;
import com.devflow.core.model.MonitoringSuggestion;
import com.devflow.core.model.MonitoringSuggestionType;
import com.devflow.core.model.Priority;
import com.devflow.core.model.UncommittedChanges;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventAggregator}.
 */
class EventAggregatorTest {

    private static final String PROJECT = "/work/app";
    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private EventAggregator aggregator;
    private List<AggregatedMilestone> milestones;
    private List<MonitoringSuggestion> suggestions;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        aggregator = newAggregator();
        milestones = new ArrayList<>();
        suggestions = new ArrayList<>();
        aggregator.milestones().subscribeAll(milestones::add);
        aggregator.suggestions().subscribeAll(suggestions::add);
    }

    private EventAggregator newAggregator() {
        return new EventAggregator(1000, Duration.ofMinutes(30), Duration.ofMinutes(5), 10,
                new DevflowMetrics(registry));
    }

    private static MonitoringEvent talk(MonitoringEventType type, Instant at) {
        return talk(type, PROJECT, at);
    }

    private static MonitoringEvent talk(MonitoringEventType type, String project, Instant at) {
        var payload = new ConversationPayload("message", "assistant", type.value(), Priority.HIGH);
        return MonitoringEvent.conversation(type, project, payload, at);
    }

    private static MonitoringEvent gitState(int fileCount, Instant at) {
        List<FileChange> files = IntStream.range(0, fileCount)
                .mapToObj(i -> new FileChange("src/File" + i + ".java", FileStatus.MODIFIED))
                .toList();
        return MonitoringEvent.gitStateChange(PROJECT, "feature/x",
                new UncommittedChanges(fileCount, fileCount + " files changed", files), null, at);
    }

    @Nested
    @DisplayName("milestones")
    class MilestoneTests {

        @Test
        @DisplayName("tests passing, docs updated and feature complete ship a feature once")
        void featureShipped() {
            var tests = talk(MonitoringEventType.TESTS_PASSING, T0);
            var docs = talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(60));
            var feature = talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(120));

            aggregator.addEvent(tests);
            aggregator.addEvent(docs);
            aggregator.addEvent(feature);

            assertEquals(1, milestones.size());
            AggregatedMilestone milestone = milestones.get(0);
            assertEquals(MilestoneType.FEATURE_SHIPPED, milestone.type());
            assertEquals(List.of(tests, docs, feature), milestone.events());
            assertEquals(feature.timestamp(), milestone.timestamp());
            assertEquals("Feature Complete with Tests and Documentation", milestone.title());
        }

        @Test
        @DisplayName("an unrelated event does not re-fire a milestone over the same member events")
        void noRefireOnSameMembers() {
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, T0));
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(1)));
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(2)));
            aggregator.addEvent(talk(MonitoringEventType.REFACTOR_COMPLETE, T0.plusSeconds(3)));

            assertEquals(1, milestones.size());
        }

        @Test
        @DisplayName("a fresh member event fires a new milestone")
        void newMemberFiresAgain() {
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, T0));
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(1)));
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(2)));
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, T0.plusSeconds(3)));

            assertEquals(2, milestones.size());
        }

        @Test
        @DisplayName("members outside the window do not count")
        void windowIsEventTime() {
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, T0));
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plus(Duration.ofMinutes(20))));
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0.plus(Duration.ofMinutes(40))));

            assertTrue(milestones.isEmpty());
        }

        @Test
        @DisplayName("events of another project are not correlated")
        void projectScoped() {
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, "/other", T0));
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(1)));
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(2)));

            assertTrue(milestones.isEmpty());
        }

        @Test
        @DisplayName("three completed features make a release-ready milestone")
        void releaseReadyFromFeatures() {
            for (int i = 0; i < 3; i++) {
                aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(i)));
            }

            List<AggregatedMilestone> releases = milestones.stream()
                    .filter(m -> m.type() == MilestoneType.RELEASE_READY)
                    .toList();
            assertEquals(1, releases.size());
            assertEquals(3, releases.get(0).events().size());
        }

        @Test
        @DisplayName("a feature, two bug fixes and passing tests make a release-ready milestone")
        void releaseReadyFromFixes() {
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0));
            aggregator.addEvent(talk(MonitoringEventType.BUG_FIXED, T0.plusSeconds(1)));
            aggregator.addEvent(talk(MonitoringEventType.BUG_FIXED, T0.plusSeconds(2)));
            aggregator.addEvent(talk(MonitoringEventType.TESTS_PASSING, T0.plusSeconds(3)));

            assertEquals(1, milestones.size());
            assertEquals(MilestoneType.RELEASE_READY, milestones.get(0).type());
            assertEquals(4, milestones.get(0).events().size());
        }

        @Test
        @DisplayName("replaying a sequence into a fresh aggregator yields the same milestones")
        void deterministicReplay() {
            List<MonitoringEvent> sequence = List.of(
                    talk(MonitoringEventType.TESTS_PASSING, T0),
                    talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(10)),
                    talk(MonitoringEventType.FEATURE_COMPLETE, T0.plusSeconds(20)),
                    talk(MonitoringEventType.BUG_FIXED, T0.plusSeconds(30)),
                    talk(MonitoringEventType.BUG_FIXED, T0.plusSeconds(40)));
            sequence.forEach(aggregator::addEvent);

            EventAggregator replay = newAggregator();
            List<AggregatedMilestone> replayed = new ArrayList<>();
            replay.milestones().subscribeAll(replayed::add);
            sequence.forEach(replay::addEvent);

            assertEquals(milestones, replayed);
        }
    }

    @Nested
    @DisplayName("suggestions")
    class SuggestionTests {

        @Test
        @DisplayName("a large uncommitted changeset suggests one medium commit")
        void largeChangeset() {
            aggregator.addEvent(gitState(15, T0));

            assertEquals(1, suggestions.size());
            MonitoringSuggestion suggestion = suggestions.get(0);
            assertEquals(MonitoringSuggestionType.COMMIT, suggestion.type());
            assertEquals(Priority.MEDIUM, suggestion.priority());
            assertEquals("You have 15 uncommitted files. Consider breaking them into smaller commits.",
                    suggestion.message());
        }

        @Test
        @DisplayName("a changeset below the threshold is quiet")
        void smallChangeset() {
            aggregator.addEvent(gitState(3, T0));

            assertTrue(suggestions.isEmpty());
        }

        @Test
        @DisplayName("feature completion suggests a checkpoint commit")
        void featureComplete() {
            aggregator.addEvent(talk(MonitoringEventType.FEATURE_COMPLETE, T0));

            assertEquals(1, suggestions.size());
            assertEquals(MonitoringSuggestionType.COMMIT, suggestions.get(0).type());
            assertEquals(Priority.HIGH, suggestions.get(0).priority());
            assertEquals("dev_checkpoint", suggestions.get(0).action());
        }

        @Test
        @DisplayName("failing tests suggest a fix without an action")
        void testsFailing() {
            aggregator.addEvent(talk(MonitoringEventType.TESTS_FAILING, T0));

            assertEquals(MonitoringSuggestionType.FIX, suggestions.get(0).type());
            assertNull(suggestions.get(0).action());
        }

        @Test
        @DisplayName("being blocked suggests opening an issue")
        void blocked() {
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0));

            assertEquals(MonitoringSuggestionType.HELP, suggestions.get(0).type());
            assertEquals("dev_issue_create", suggestions.get(0).action());
        }

        @Test
        @DisplayName("the third bug fix within a day suggests a patch release")
        void bugFixRelease() {
            aggregator.addEvent(talk(MonitoringEventType.BUG_FIXED, T0));
            aggregator.addEvent(talk(MonitoringEventType.BUG_FIXED, T0.plus(Duration.ofHours(2))));
            assertTrue(suggestions.isEmpty());

            aggregator.addEvent(talk(MonitoringEventType.BUG_FIXED, T0.plus(Duration.ofHours(4))));

            assertEquals(1, suggestions.size());
            assertEquals(MonitoringSuggestionType.RELEASE, suggestions.get(0).type());
            assertEquals(3, suggestions.get(0).relatedEvents().size());
        }

        @Test
        @DisplayName("a repeated trigger inside the cooldown is suppressed, after it is emitted again")
        void cooldown() {
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0));
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0.plus(Duration.ofMinutes(2))));
            assertEquals(1, suggestions.size());

            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0.plus(Duration.ofMinutes(5))));
            assertEquals(2, suggestions.size());
        }

        @Test
        @DisplayName("cooldown is tracked per project")
        void cooldownPerProject() {
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0));
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, "/other", T0.plusSeconds(1)));

            assertEquals(2, suggestions.size());
        }

        @Test
        @DisplayName("decision loop events are buffered but trigger no rules")
        void llmEventsAreInert() {
            var payload = new DecisionPayload("d-1", LlmDecision.safeDefault("x"), MonitoringEventType.BLOCKED);
            aggregator.addEvent(MonitoringEvent.decision(MonitoringEventType.LLM_DECISION_MADE, PROJECT, payload, T0));

            assertTrue(suggestions.isEmpty());
            assertEquals(1, aggregator.getStats().totalEvents());
        }

        @Test
        @DisplayName("emitted suggestions are counted")
        void metricsRecorded() {
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0));

            assertEquals(1.0, registry.get("devflow.monitoring.suggestions").counter().count());
        }
    }

    @Nested
    @DisplayName("queries")
    class QueryTests {

        @Test
        @DisplayName("stats count by type and by recency relative to the newest event")
        void stats() {
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0));
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plus(Duration.ofHours(3))));
            aggregator.addEvent(talk(MonitoringEventType.REFACTOR_COMPLETE, T0.plus(Duration.ofHours(3))));

            EventStats stats = aggregator.getStats();

            assertEquals(3, stats.totalEvents());
            assertEquals(2, stats.eventsLastHour());
            assertEquals(3, stats.eventsLastDay());
            assertEquals(2, stats.eventTypes().get(MonitoringEventType.DOCS_UPDATED));
        }

        @Test
        @DisplayName("empty aggregator reports zero stats")
        void emptyStats() {
            assertEquals(0, aggregator.getStats().totalEvents());
        }

        @Test
        @DisplayName("recent events can be filtered by project")
        void recentEventsByProject() {
            var mine = talk(MonitoringEventType.DOCS_UPDATED, T0);
            aggregator.addEvent(mine);
            aggregator.addEvent(talk(MonitoringEventType.DOCS_UPDATED, "/other", T0.plusSeconds(1)));

            assertEquals(List.of(mine), aggregator.getRecentEvents(PROJECT, 10));
            assertEquals(2, aggregator.getRecentEvents(10).size());
        }

        @Test
        @DisplayName("the buffer keeps only the newest events")
        void bufferBounded() {
            var small = new EventAggregator(2, Duration.ofMinutes(30), Duration.ofMinutes(5), 10,
                    new DevflowMetrics(registry));
            small.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0));
            small.addEvent(talk(MonitoringEventType.DOCS_UPDATED, T0.plusSeconds(1)));
            var newest = talk(MonitoringEventType.REFACTOR_COMPLETE, T0.plusSeconds(2));
            small.addEvent(newest);

            assertEquals(2, small.getStats().totalEvents());
            assertEquals(newest, small.getRecentEvents(1).get(0));
        }

        @Test
        @DisplayName("clear forgets events, cooldowns and subscribers")
        void clear() {
            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0));
            aggregator.clear();
            List<MonitoringSuggestion> after = new ArrayList<>();
            aggregator.suggestions().subscribeAll(after::add);

            aggregator.addEvent(talk(MonitoringEventType.BLOCKED, T0.plusSeconds(1)));

            assertEquals(1, aggregator.getStats().totalEvents());
            assertEquals(1, after.size());
            assertEquals(1, suggestions.size());
        }
    }
}
