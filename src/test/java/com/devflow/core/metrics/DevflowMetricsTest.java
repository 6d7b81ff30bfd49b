package com.devflow.core.metrics;

import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.MilestoneType;
import com.devflow.core.model.MonitoringSuggestionType;
import com.devflow.core.model.SuggestionType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DevflowMetricsTest {

    private SimpleMeterRegistry registry;
    private DevflowMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DevflowMetrics(registry);
    }

    @Test
    @DisplayName("recordDecision counts by action and approval")
    void recordDecision() {
        metrics.recordDecision(DecisionAction.COMMIT, false);
        metrics.recordDecision(DecisionAction.COMMIT, false);
        metrics.recordDecision(DecisionAction.WAIT, true);

        var commits = registry.find("devflow.decisions.total").tag("action", "commit").counter();
        var waits = registry.find("devflow.decisions.total").tag("action", "wait").counter();

        assertNotNull(commits);
        assertNotNull(waits);
        assertEquals(2.0, commits.count());
        assertEquals(1.0, waits.count());
    }

    @Test
    @DisplayName("recordDecisionDuration creates a timer")
    void recordDecisionDuration() {
        metrics.recordDecisionDuration(250);
        var timer = registry.find("devflow.decision.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordFallback and recordEscalation tag their cause")
    void fallbacksAndEscalations() {
        metrics.recordFallback("LlmTimeoutException");
        metrics.recordEscalation("protected_files");

        assertEquals(1.0, registry.find("devflow.decisions.fallbacks")
                .tag("cause", "LlmTimeoutException").counter().count());
        assertEquals(1.0, registry.find("devflow.safety.escalations")
                .tag("check", "protected_files").counter().count());
    }

    @Test
    @DisplayName("milestones and suggestions are counted by type")
    void milestonesAndSuggestions() {
        metrics.recordMilestone(MilestoneType.FEATURE_SHIPPED);
        metrics.recordMonitoringSuggestion(MonitoringSuggestionType.HELP);
        metrics.recordSuggestion(SuggestionType.PR, true);
        metrics.recordSuggestion(SuggestionType.PR, false);

        assertEquals(1.0, registry.find("devflow.milestones.total").tag("type", "feature_shipped").counter().count());
        assertEquals(1.0, registry.find("devflow.monitoring.suggestions").tag("type", "help").counter().count());
        assertEquals(1.0, registry.find("devflow.suggestions.total").tag("origin", "llm").counter().count());
        assertEquals(1.0, registry.find("devflow.suggestions.total").tag("origin", "rule").counter().count());
    }
}
