package com.devflow.core.llm;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.learning.LearningEngine;
import com.devflow.core.learning.LearningInsights;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.PrDescription;
import com.devflow.core.model.ProjectState;
import com.devflow.core.model.RiskAssessment;
import com.devflow.core.safety.SafetyGate;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns a {@link DecisionContext} into a gated {@link LlmDecision}.
 * <p>
 * Pipeline: prompt, completion (bounded by {@code devflow.automation.llm.timeout-seconds}),
 * parse, learning adjustments, then the {@link SafetyGate}. {@link #makeDecision} never throws;
 * any failure yields {@link LlmDecision#safeDefault}. There are no retries.
 */
@Service
public class LlmDecisionAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmDecisionAgent.class);

    private final CompletionProvider provider;
    private final PromptBuilder promptBuilder;
    private final SafetyGate safetyGate;
    private final AutomationProperties automation;
    private final LearningEngine learningEngine;
    private final DevflowMetrics metrics;
    private final Executor executor;
    private final LlmJsonParser jsonParser = new LlmJsonParser();

    private volatile boolean initialized;

    public LlmDecisionAgent(CompletionProvider provider,
                            PromptBuilder promptBuilder,
                            SafetyGate safetyGate,
                            AutomationProperties automation,
                            @Autowired(required = false) LearningEngine learningEngine,
                            DevflowMetrics metrics,
                            @Qualifier("devflowExecutor") Executor executor) {
        this.provider = provider;
        this.promptBuilder = promptBuilder;
        this.safetyGate = safetyGate;
        this.automation = automation;
        this.learningEngine = learningEngine;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * Checks that the provider can serve requests. Until this succeeds every decision is the safe default.
     *
     * @return whether the agent is ready
     */
    public boolean initialize() {
        try {
            initialized = provider.isAvailable();
        } catch (Exception e) {
            log.warn("Completion provider {} failed its availability check: {}", provider.getName(), e.getMessage());
            initialized = false;
        }
        if (initialized) {
            log.info("Decision agent initialized with provider {}", provider.getName());
        } else {
            log.warn("Decision agent could not initialize provider {}", provider.getName());
        }
        return initialized;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public LlmDecision makeDecision(DecisionContext context) {
        long start = System.currentTimeMillis();
        try {
            if (!initialized) {
                throw new IllegalStateException("Decision agent is not initialized");
            }
            List<LlmMessage> messages = promptBuilder.buildDecisionPrompt(context);
            LlmResponse response = complete(messages);
            LlmDecision decision = provider.parseDecision(response.content());
            decision = applyLearning(decision, context);
            LlmDecision gated = safetyGate.apply(decision, context);

            metrics.recordDecision(gated.action(), gated.requiresApproval());
            log.info("Decision for {}: {} (confidence {}, approval {})", context.projectPath(),
                    gated.action().value(), String.format("%.2f", gated.confidence()), gated.requiresApproval());
            return gated;
        } catch (Exception e) {
            String message = describe(e);
            log.warn("Decision for {} failed, falling back to wait: {}", context.projectPath(), message);
            metrics.recordFallback(e.getClass().getSimpleName());
            return LlmDecision.safeDefault(message);
        } finally {
            metrics.recordDecisionDuration(System.currentTimeMillis() - start);
        }
    }

    public CompletableFuture<LlmDecision> makeDecisionAsync(DecisionContext context) {
        return CompletableFuture.supplyAsync(() -> makeDecision(context), executor);
    }

    /**
     * @return the trimmed commit message text
     * @throws LlmEmptyResponseException when the model returns no text
     */
    public String generateCommitMessage(String diffSummary, ProjectState state, List<String> recentCommits) {
        LlmResponse response = complete(promptBuilder.buildCommitMessagePrompt(diffSummary, state, recentCommits));
        if (response.content() == null || response.content().isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for commit message");
        }
        return response.content().trim();
    }

    /**
     * @throws LlmParseException when the response is not a JSON object with a title and a body
     */
    public PrDescription generatePrDescription(String branchName, List<String> commits, String changesSummary) {
        LlmResponse response = complete(promptBuilder.buildPrDescriptionPrompt(branchName, commits, changesSummary));
        JsonNode node = jsonParser.readObject(response.content())
                .orElseThrow(() -> new LlmParseException("Failed to parse PR description"));
        JsonNode title = node.get("title");
        JsonNode body = node.get("body");
        if (title == null || !title.isTextual() || body == null || !body.isTextual()) {
            throw new LlmParseException("Failed to parse PR description: title and body are required");
        }
        return new PrDescription(title.asText(), body.asText());
    }

    /**
     * Never throws; an unparseable or failed assessment is reported as critical.
     */
    public RiskAssessment assessRisk(DecisionContext context) {
        try {
            LlmResponse response = complete(promptBuilder.buildRiskAssessmentPrompt(context));
            return jsonParser.readObject(response.content())
                    .map(node -> jsonParser.convert(node, RiskAssessment.class))
                    .filter(risk -> risk.level() != null)
                    .orElseGet(RiskAssessment::unassessable);
        } catch (Exception e) {
            log.warn("Risk assessment for {} failed: {}", context.projectPath(), describe(e));
            return RiskAssessment.unassessable();
        }
    }

    private LlmDecision applyLearning(LlmDecision decision, DecisionContext context) {
        if (learningEngine == null || !automation.getLearning().isEnabled()) {
            return decision;
        }
        LearningInsights insights = learningEngine.analyzeDecision(decision, context);
        if (!insights.shouldProceed()) {
            log.info("Learning engine vetoed {} for {}", decision.action().value(), context.projectPath());
            return new LlmDecision(DecisionAction.WAIT, 0.2,
                    "Learning system suggests waiting: " + insights.joinedReasoning(), true);
        }
        LlmDecision adjusted = decision;
        if (insights.adjustedDecision() != null) {
            adjusted = insights.adjustedDecision().applyTo(decision)
                    .withReasoning(decision.reasoning() + " (Learning: " + insights.joinedReasoning() + ")");
        }
        return adjusted.withConfidence(learningEngine.adjustConfidence(adjusted, context));
    }

    /**
     * Runs the completion on the executor and waits at most the configured timeout.
     */
    private LlmResponse complete(List<LlmMessage> messages) {
        int timeoutSeconds = automation.getLlm().getTimeoutSeconds();
        CompletableFuture<LlmResponse> call = CompletableFuture.supplyAsync(() -> provider.complete(messages), executor);
        try {
            LlmResponse response = call.get(timeoutSeconds, TimeUnit.SECONDS);
            if (response == null) {
                throw new LlmEmptyResponseException("Provider " + provider.getName() + " returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmTimeoutException("LLM request timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new LlmProviderException("Provider " + provider.getName() + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmProviderException("Interrupted while waiting for " + provider.getName(), e);
        }
    }

    private static String describe(Throwable error) {
        Throwable root = error;
        while ((root instanceof CompletionException || root instanceof ExecutionException) && root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
