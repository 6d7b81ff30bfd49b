package com.devflow.core.metrics;

import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.MilestoneType;
import com.devflow.core.model.MonitoringSuggestionType;
import com.devflow.core.model.SuggestionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the monitoring and decision pipeline.
 */
@Service
public class DevflowMetrics {

    private final MeterRegistry registry;

    public DevflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(DecisionAction action, boolean requiresApproval) {
        Counter.builder("devflow.decisions.total")
                .tag("action", action.value())
                .tag("approval", String.valueOf(requiresApproval))
                .register(registry)
                .increment();
    }

    public void recordDecisionDuration(long ms) {
        Timer.builder("devflow.decision.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records a decision that fell back to the safe default.
     *
     * @param cause short cause, typically the exception's simple class name
     */
    public void recordFallback(String cause) {
        Counter.builder("devflow.decisions.fallbacks")
                .description("Decisions replaced by the safe default")
                .tag("cause", cause)
                .register(registry)
                .increment();
    }

    public void recordEscalation(String check) {
        Counter.builder("devflow.safety.escalations")
                .description("Decisions forced to require approval by a safety check")
                .tag("check", check)
                .register(registry)
                .increment();
    }

    public void recordMilestone(MilestoneType type) {
        Counter.builder("devflow.milestones.total")
                .tag("type", type.value())
                .register(registry)
                .increment();
    }

    public void recordMonitoringSuggestion(MonitoringSuggestionType type) {
        Counter.builder("devflow.monitoring.suggestions")
                .tag("type", type.value())
                .register(registry)
                .increment();
    }

    public void recordSuggestion(SuggestionType type, boolean fromLlm) {
        Counter.builder("devflow.suggestions.total")
                .tag("type", type.value())
                .tag("origin", fromLlm ? "llm" : "rule")
                .register(registry)
                .increment();
    }
}
