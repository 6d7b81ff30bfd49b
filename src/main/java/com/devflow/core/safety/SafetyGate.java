package com.devflow.core.safety;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.llm.LlmTimeoutException;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.TestStatus;
import com.devflow.core.model.TimeContext;
import com.devflow.core.model.WorkingHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Final gate every decision passes before it leaves the agent.
 * <p>
 * Checks run in a fixed order and can only add approval requirements, never remove them:
 * automation inactive, confidence below threshold, outside working hours, protected files
 * touched, tests not passing. Emergency stop then replaces the decision with a wait.
 */
@Component
public class SafetyGate {

    private static final Logger log = LoggerFactory.getLogger(SafetyGate.class);

    static final String EMERGENCY_STOP_REASONING = "Emergency stop is active";

    private final AutomationProperties automation;
    private final TimeContextProvider timeContextProvider;
    private final TestCheck testCheck;
    private final DevflowMetrics metrics;
    private final Executor executor;
    private final ProtectedFileMatcher protectedFiles;
    private final List<SafetyCheck> checks;

    public SafetyGate(AutomationProperties automation,
                      TimeContextProvider timeContextProvider,
                      @Autowired(required = false) TestCheck testCheck,
                      DevflowMetrics metrics,
                      @Qualifier("devflowExecutor") Executor executor) {
        this.automation = automation;
        this.timeContextProvider = timeContextProvider;
        this.testCheck = testCheck;
        this.metrics = metrics;
        this.executor = executor;
        this.protectedFiles = new ProtectedFileMatcher(automation.getSafety().getProtectedFiles());
        this.checks = List.of(
                this::automationInactive,
                this::lowConfidence,
                this::outsideWorkingHours,
                this::touchesProtectedFiles,
                this::testsNotPassing);
    }

    /**
     * Applies every check to {@code decision}.
     *
     * @throws LlmTimeoutException when the test check exceeds its time bound
     */
    public LlmDecision apply(LlmDecision decision, DecisionContext context) {
        boolean requiresApproval = decision.requiresApproval();
        var reasoning = new StringBuilder(decision.reasoning());

        for (SafetyCheck check : checks) {
            Optional<SafetyFinding> finding = check.evaluate(decision, context);
            if (finding.isPresent()) {
                requiresApproval = true;
                metrics.recordEscalation(finding.get().check());
                if (finding.get().note() != null) {
                    reasoning.append(" (").append(finding.get().note()).append(")");
                }
            }
        }

        LlmDecision gated = decision.withReasoning(reasoning.toString()).withRequiresApproval(requiresApproval);

        if (automation.getSafety().isEmergencyStop()) {
            log.warn("Emergency stop active, holding decision for {}", context.projectPath());
            metrics.recordEscalation("emergency_stop");
            return new LlmDecision(DecisionAction.WAIT, gated.confidence(), EMERGENCY_STOP_REASONING, true,
                    gated.alternativeActions(), gated.riskAssessment());
        }
        return gated;
    }

    private Optional<SafetyFinding> automationInactive(LlmDecision decision, DecisionContext context) {
        return automation.isActive() ? Optional.empty() : Optional.of(SafetyFinding.silent("automation_inactive"));
    }

    private Optional<SafetyFinding> lowConfidence(LlmDecision decision, DecisionContext context) {
        return decision.confidence() < automation.getThresholds().getConfidence()
                ? Optional.of(SafetyFinding.silent("low_confidence"))
                : Optional.empty();
    }

    private Optional<SafetyFinding> outsideWorkingHours(LlmDecision decision, DecisionContext context) {
        WorkingHours hours = automation.getPreferences().toUserPreferences().workingHours();
        if (hours == null) {
            return Optional.empty();
        }
        TimeContext time = context.timeContext() != null ? context.timeContext() : timeContextProvider.current(hours);
        return time.isWorkingHours()
                ? Optional.empty()
                : Optional.of(new SafetyFinding("working_hours", "Outside working hours"));
    }

    private Optional<SafetyFinding> touchesProtectedFiles(LlmDecision decision, DecisionContext context) {
        return protectedFiles.matchesAny(context.currentEvent().files())
                ? Optional.of(new SafetyFinding("protected_files", "Touches protected files"))
                : Optional.empty();
    }

    private Optional<SafetyFinding> testsNotPassing(LlmDecision decision, DecisionContext context) {
        if (!automation.getSafety().isRequireTestsPass()) {
            return Optional.empty();
        }
        TestStatus status = context.projectState() != null ? context.projectState().testStatus() : TestStatus.UNKNOWN;
        boolean passing = switch (status) {
            case PASSING -> true;
            case FAILING -> false;
            case UNKNOWN -> runTestCheck(context.projectPath());
        };
        return passing ? Optional.empty() : Optional.of(new SafetyFinding("tests", "Tests not passing"));
    }

    private boolean runTestCheck(String projectPath) {
        if (testCheck == null) {
            log.debug("No test check available for {}, treating tests as not passing", projectPath);
            return false;
        }
        int timeoutSeconds = automation.getSafety().getTestTimeoutSeconds();
        CompletableFuture<Boolean> run = CompletableFuture.supplyAsync(() -> testCheck.testsPass(projectPath), executor);
        try {
            return run.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            run.cancel(true);
            throw new LlmTimeoutException("Test check timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof LlmTimeoutException timeout) {
                throw timeout;
            }
            log.warn("Test check failed for {}, treating tests as not passing: {}",
                    projectPath, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for test check", e);
        }
    }
}
