package com.devflow.core.monitoring;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.config.MonitoringProperties;
import com.devflow.core.events.EventChannel;
import com.devflow.core.git.ProjectStateReader;
import com.devflow.core.llm.LlmDecisionAgent;
import com.devflow.core.logging.MdcContext;
import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.DecisionNotice;
import com.devflow.core.model.DecisionPayload;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.MonitoringEventType;
import com.devflow.core.model.UserPreferences;
import com.devflow.core.safety.TimeContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Asks the decision agent what to do after each monitoring event.
 * <p>
 * Active only while automation is enabled. At most one decision is in flight; events arriving
 * meanwhile are skipped. The loop records its own progress as LLM_* events in the aggregator
 * and publishes notices for decisions that need approval or are ready to execute.
 */
@Service
public class DecisionLoop {

    private static final Logger log = LoggerFactory.getLogger(DecisionLoop.class);

    static final List<DecisionAction> POSSIBLE_ACTIONS = List.of(
            DecisionAction.COMMIT, DecisionAction.BRANCH, DecisionAction.PR, DecisionAction.STASH,
            DecisionAction.CHECKPOINT, DecisionAction.SUGGEST, DecisionAction.WAIT);

    private final LlmDecisionAgent agent;
    private final EventAggregator aggregator;
    private final ProjectStateReader projectStateReader;
    private final TimeContextProvider timeContextProvider;
    private final AutomationProperties automation;
    private final int recentHistorySize;
    private final Executor executor;
    private final Clock clock;

    private final AtomicBoolean inFlight = new AtomicBoolean();
    private final AtomicLong decisionCounter = new AtomicLong();

    private final EventChannel<DecisionNotice> approvalRequired =
            new EventChannel<>("approval-required", n -> n.context().projectPath());
    private final EventChannel<DecisionNotice> actionReady =
            new EventChannel<>("action-ready", n -> n.context().projectPath());

    public DecisionLoop(LlmDecisionAgent agent,
                        EventAggregator aggregator,
                        ProjectStateReader projectStateReader,
                        TimeContextProvider timeContextProvider,
                        AutomationProperties automation,
                        MonitoringProperties monitoring,
                        @Qualifier("devflowExecutor") Executor executor,
                        Clock clock) {
        this.agent = agent;
        this.aggregator = aggregator;
        this.projectStateReader = projectStateReader;
        this.timeContextProvider = timeContextProvider;
        this.automation = automation;
        this.recentHistorySize = monitoring.getRecentHistorySize();
        this.executor = executor;
        this.clock = clock;
    }

    public EventChannel<DecisionNotice> approvalRequired() {
        return approvalRequired;
    }

    public EventChannel<DecisionNotice> actionReady() {
        return actionReady;
    }

    /**
     * Schedules a decision for {@code event} unless automation is off, the event came from
     * this loop, or another decision is still running.
     */
    public void onEvent(MonitoringEvent event) {
        if (!automation.isActive() || event.type().isLlmEvent()) {
            return;
        }
        if (!inFlight.compareAndSet(false, true)) {
            log.debug("Decision already in flight, skipping {} for {}", event.type().value(), event.projectPath());
            return;
        }
        try {
            executor.execute(() -> {
                try {
                    decide(event);
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            log.warn("Decision for {} rejected by executor: {}", event.projectPath(), e.getMessage());
        }
    }

    void decide(MonitoringEvent trigger) {
        String projectPath = trigger.projectPath();
        MdcContext.setProject(projectPath);
        try {
            if (!agent.isInitialized() && !agent.initialize()) {
                return;
            }
            aggregator.addEvent(MonitoringEvent.decision(MonitoringEventType.LLM_DECISION_REQUESTED, projectPath,
                    new DecisionPayload(null, null, trigger.type()), clock.instant()));

            DecisionContext context = buildContext(trigger);
            String decisionId = "decision-" + clock.millis() + "-" + decisionCounter.incrementAndGet();
            MdcContext.setDecision(projectPath, decisionId);

            LlmDecision decision = agent.makeDecision(context);
            DecisionPayload payload = new DecisionPayload(decisionId, decision, trigger.type());
            aggregator.addEvent(MonitoringEvent.decision(MonitoringEventType.LLM_DECISION_MADE, projectPath,
                    payload, clock.instant()));

            DecisionNotice notice = new DecisionNotice(decisionId, decision, context);
            if (decision.requiresApproval()) {
                aggregator.addEvent(MonitoringEvent.decision(MonitoringEventType.LLM_APPROVAL_REQUIRED, projectPath,
                        payload, clock.instant()));
                approvalRequired.publish(notice);
            } else if (decision.confidence() >= automation.getThresholds().getAutoExecute()) {
                actionReady.publish(notice);
            }
        } catch (Exception e) {
            log.error("Decision loop failed for {}: {}", projectPath, e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }
    }

    private DecisionContext buildContext(MonitoringEvent trigger) {
        UserPreferences preferences = automation.getPreferences().toUserPreferences();
        List<MonitoringEvent> history = aggregator.getRecentEvents(trigger.projectPath(), recentHistorySize + 1)
                .stream()
                .filter(e -> !e.type().isLlmEvent() && !e.equals(trigger))
                .toList();
        return new DecisionContext(
                trigger,
                projectStateReader.read(trigger.projectPath()),
                history,
                preferences,
                POSSIBLE_ACTIONS,
                timeContextProvider.current(preferences.workingHours()));
    }
}
