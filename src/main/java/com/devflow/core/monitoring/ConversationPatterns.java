package com.devflow.core.monitoring;

import com.devflow.core.model.MonitoringEventType;
import com.devflow.core.model.Priority;

import java.util.List;

import static com.devflow.core.monitoring.ConversationPattern.of;

/**
 * Default catalog of phrases recognized in narrated development conversation.
 * Order matters only for the order in which events are emitted.
 */
public final class ConversationPatterns {

    public static final List<ConversationPattern> DEFAULT = List.of(
            // Feature development
            of("feature_complete",
                    "(?:implemented|created|added|built|finished)\\s+(?:the\\s+)?(?:new\\s+)?feature",
                    MonitoringEventType.FEATURE_COMPLETE, Priority.HIGH),
            of("feature_start",
                    "(?:let's|I'll|starting to|going to)\\s+(?:implement|create|add|build)\\s+(?:a\\s+)?(?:new\\s+)?feature",
                    MonitoringEventType.FEATURE_START, Priority.MEDIUM),

            // Bugs
            of("bug_fix",
                    "(?:fixed|resolved|patched|corrected)\\s+(?:the\\s+)?(?:bug|issue|problem|error)",
                    MonitoringEventType.BUG_FIXED, Priority.HIGH),
            of("bug_found",
                    "(?:found|discovered|there's|encountering)\\s+(?:a\\s+)?(?:bug|issue|problem|error)",
                    MonitoringEventType.BUG_FOUND, Priority.MEDIUM),

            // Tests
            of("tests_added",
                    "(?:added|created|wrote|implemented)\\s+(?:new\\s+)?tests?\\b",
                    MonitoringEventType.TESTS_ADDED, Priority.MEDIUM),
            of("tests_passing",
                    "(?:all\\s+)?\\btests?\\s+(?:are\\s+)?(?:passing|pass|green|successful)",
                    MonitoringEventType.TESTS_PASSING, Priority.HIGH),
            of("tests_failing",
                    "\\btests?\\s+(?:are\\s+)?(?:failing|fail|red|broken)",
                    MonitoringEventType.TESTS_FAILING, Priority.HIGH),

            of("refactor_complete",
                    "(?:refactored|reorganized|restructured|cleaned up)\\s+(?:the\\s+)?code",
                    MonitoringEventType.REFACTOR_COMPLETE, Priority.MEDIUM),

            of("docs_updated",
                    "(?:updated|added|wrote|created)\\s+(?:the\\s+)?(?:documentation|docs|README)",
                    MonitoringEventType.DOCS_UPDATED, Priority.LOW),

            // Release and deployment
            of("ready_for_release",
                    "(?:ready\\s+for|time\\s+to|should\\s+create)\\s+(?:a\\s+)?release",
                    MonitoringEventType.READY_FOR_RELEASE, Priority.HIGH),
            of("deployment_ready",
                    "(?:ready\\s+to|time\\s+to|can\\s+now)\\s+deploy",
                    MonitoringEventType.DEPLOYMENT_READY, Priority.HIGH),

            of("milestone_reached",
                    "(?:completed|finished|done with)\\s+(?:the\\s+)?(?:milestone|major\\s+feature|sprint)",
                    MonitoringEventType.MILESTONE_REACHED, Priority.HIGH),
            of("blocked",
                    "\\b(?:blocked|stuck|can't\\s+proceed|waiting\\s+for)",
                    MonitoringEventType.BLOCKED, Priority.HIGH)
    );

    private ConversationPatterns() {}
}
