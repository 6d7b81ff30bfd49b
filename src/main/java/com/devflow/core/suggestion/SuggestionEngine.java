package com.devflow.core.suggestion;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.config.GitWorkflowProperties;
import com.devflow.core.llm.LlmDecisionAgent;
import com.devflow.core.logging.MdcContext;
import com.devflow.core.metrics.DevflowMetrics;
import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.DevelopmentStatus;
import com.devflow.core.model.FileChange;
import com.devflow.core.model.FileStatus;
import com.devflow.core.model.LlmDecision;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.Priority;
import com.devflow.core.model.ProjectState;
import com.devflow.core.model.Suggestion;
import com.devflow.core.model.SuggestionType;
import com.devflow.core.model.UncommittedChanges;
import com.devflow.core.model.UserPreferences;
import com.devflow.core.safety.TimeContextProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Produces a prioritized list of suggestions for a project's current git status.
 * <p>
 * When automation is active the decision agent is asked first; rule checks always run.
 * Results are de-duplicated by type and action (the agent's entry wins) and ordered by
 * priority, then confidence. A failing agent never prevents the rule-based suggestions.
 */
@Service
public class SuggestionEngine {

    private static final Logger log = LoggerFactory.getLogger(SuggestionEngine.class);

    private static final Duration HINT_WINDOW = Duration.ofMinutes(5);
    private static final List<String> FEATURE_DIRECTORIES = List.of("components/", "features/", "pages/");
    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "ts", "tsx", "js", "jsx", "py", "go", "rs", "rb", "cs");

    private static final List<DecisionAction> POSSIBLE_ACTIONS = List.of(
            DecisionAction.COMMIT, DecisionAction.BRANCH, DecisionAction.PR,
            DecisionAction.CHECKPOINT, DecisionAction.SUGGEST, DecisionAction.WAIT);

    private static final Comparator<Suggestion> ORDER = Comparator
            .comparing(Suggestion::priority)
            .thenComparing(Comparator.comparingDouble(Suggestion::confidenceOrZero).reversed());

    private final SuggestionProperties suggestionProperties;
    private final AutomationProperties automation;
    private final GitWorkflowProperties gitWorkflow;
    private final LlmDecisionAgent decisionAgent;
    private final TimeContextProvider timeContextProvider;
    private final DevflowMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    private final Map<String, WorkContext> workContexts = new ConcurrentHashMap<>();

    public SuggestionEngine(SuggestionProperties suggestionProperties,
                            AutomationProperties automation,
                            GitWorkflowProperties gitWorkflow,
                            @Autowired(required = false) LlmDecisionAgent decisionAgent,
                            TimeContextProvider timeContextProvider,
                            DevflowMetrics metrics,
                            @Qualifier("devflowExecutor") Executor executor,
                            Clock clock) {
        this.suggestionProperties = suggestionProperties;
        this.automation = automation;
        this.gitWorkflow = gitWorkflow;
        this.decisionAgent = decisionAgent;
        this.timeContextProvider = timeContextProvider;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
    }

    public List<Suggestion> analyzeSituation(String projectPath, DevelopmentStatus status) {
        MdcContext.setProject(projectPath);
        try {
            Instant now = clock.instant();
            WorkContext context = getOrCreateContext(projectPath);
            context.observe(status, now);

            EffectiveSuggestionConfig config = suggestionProperties.resolve(projectPath);
            if (!config.enabled()) {
                log.debug("Suggestions disabled for {}", projectPath);
                return List.of();
            }

            List<Suggestion> suggestions = new ArrayList<>();
            if (llmPathAvailable()) {
                suggestions.addAll(getLlmSuggestions(projectPath, status, context));
            }
            if (config.protectedBranchWarnings()) {
                suggestions.addAll(checkProtectedBranch(status));
            }
            suggestions.addAll(checkUncommittedChanges(status, config));
            if (config.timeRemindersEnabled()) {
                suggestions.addAll(checkTimeBasedSuggestions(status, context, config, now));
            }
            if (config.patternRecognition()) {
                suggestions.addAll(checkChangePatterns(status));
            }
            if (config.branchSuggestions()) {
                suggestions.addAll(checkBranchSuggestions(status));
            }
            if (config.prSuggestions()) {
                suggestions.addAll(checkPrReadiness(status));
            }

            List<Suggestion> result = deduplicate(suggestions);
            result.sort(ORDER);
            result.forEach(s -> metrics.recordSuggestion(s.type(), s.fromLlm()));
            log.debug("{} suggestion(s) for {}", result.size(), projectPath);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    public CompletableFuture<List<Suggestion>> analyzeSituationAsync(String projectPath, DevelopmentStatus status) {
        return CompletableFuture.supplyAsync(() -> analyzeSituation(projectPath, status), executor);
    }

    public List<String> getContextualHints(String projectPath) {
        WorkContext context = getOrCreateContext(projectPath);
        Instant now = clock.instant();
        List<String> hints = new ArrayList<>();

        if (Duration.between(context.getSessionStartTime(), now).compareTo(HINT_WINDOW) < 0) {
            hints.add("Starting a new session? Run 'dev_status' to see your current state.");
        }
        Instant lastCommit = context.getLastCommitTime();
        if (lastCommit != null && Duration.between(lastCommit, now).compareTo(HINT_WINDOW) < 0) {
            hints.add("Great job committing! Consider creating a PR if your feature is complete.");
        }
        return hints;
    }

    /**
     * @return the project's work context, created on first use
     */
    public WorkContext getWorkContext(String projectPath) {
        return getOrCreateContext(projectPath);
    }

    private WorkContext getOrCreateContext(String projectPath) {
        return workContexts.computeIfAbsent(projectPath, p -> new WorkContext(clock.instant()));
    }

    // ---- Decision agent ----

    private boolean llmPathAvailable() {
        if (decisionAgent == null || !automation.isActive()) {
            return false;
        }
        return decisionAgent.isInitialized() || decisionAgent.initialize();
    }

    private List<Suggestion> getLlmSuggestions(String projectPath, DevelopmentStatus status, WorkContext context) {
        try {
            UserPreferences preferences = automation.getPreferences().toUserPreferences();
            MonitoringEvent event = MonitoringEvent.gitStateChange(projectPath, status.branch(),
                    status.uncommittedChanges(), null, clock.instant());
            ProjectState state = new ProjectState(status.branch(), status.isProtected(),
                    status.uncommittedFileCount(), context.getLastCommitTime(), null, null);
            DecisionContext decisionContext = new DecisionContext(event, state, List.of(), preferences,
                    POSSIBLE_ACTIONS, timeContextProvider.current(preferences.workingHours()));

            LlmDecision decision = decisionAgent.makeDecision(decisionContext);
            if (decision.action() == DecisionAction.WAIT) {
                return List.of();
            }
            return List.of(new Suggestion(
                    suggestionTypeFor(decision.action()),
                    priorityFor(decision.confidence()),
                    decision.reasoning(),
                    devActionFor(decision.action()),
                    "AI confidence: " + Math.round(decision.confidence() * 100) + "%",
                    true,
                    decision.confidence()));
        } catch (Exception e) {
            log.warn("LLM suggestions failed for {}, continuing with rules only: {}", projectPath, e.getMessage());
            return List.of();
        }
    }

    static SuggestionType suggestionTypeFor(DecisionAction action) {
        return switch (action) {
            case COMMIT -> SuggestionType.COMMIT;
            case BRANCH -> SuggestionType.BRANCH;
            case PR -> SuggestionType.PR;
            case CHECKPOINT -> SuggestionType.CHECKPOINT;
            default -> SuggestionType.WARNING;
        };
    }

    static String devActionFor(DecisionAction action) {
        return switch (action) {
            case COMMIT -> "dev_checkpoint";
            case BRANCH -> "dev_create_branch";
            case PR -> "dev_create_pull_request";
            default -> null;
        };
    }

    static Priority priorityFor(double confidence) {
        if (confidence > 0.8) {
            return Priority.HIGH;
        }
        return confidence > 0.5 ? Priority.MEDIUM : Priority.LOW;
    }

    // ---- Rule checks ----

    private List<Suggestion> checkProtectedBranch(DevelopmentStatus status) {
        if (!status.isProtected() || !status.hasUncommittedChanges()) {
            return List.of();
        }
        return List.of(Suggestion.rule(SuggestionType.WARNING, Priority.HIGH,
                "You're working directly on protected branch '" + status.branch() + "'",
                "dev_create_branch",
                "Protected branches should not receive direct commits. Create a feature branch instead."));
    }

    private List<Suggestion> checkUncommittedChanges(DevelopmentStatus status, EffectiveSuggestionConfig config) {
        UncommittedChanges changes = status.uncommittedChanges();
        if (changes == null || changes.fileCount() == 0) {
            return List.of();
        }
        List<Suggestion> suggestions = new ArrayList<>();
        if (config.largeChangesetEnabled() && changes.fileCount() >= config.largeChangesetThreshold()) {
            suggestions.add(Suggestion.rule(SuggestionType.COMMIT, Priority.MEDIUM,
                    "You have " + changes.fileCount() + " uncommitted files",
                    "dev_checkpoint",
                    "Large changesets are harder to review. Consider committing your progress."));
        }
        if (config.changePatternSuggestions()
                && changes.hasStatus(FileStatus.ADDED)
                && changes.hasStatus(FileStatus.MODIFIED)
                && changes.hasStatus(FileStatus.DELETED)) {
            suggestions.add(Suggestion.rule(SuggestionType.COMMIT, Priority.LOW,
                    "You have mixed changes (additions, modifications, and deletions)",
                    null,
                    "Consider splitting these into atomic commits."));
        }
        return suggestions;
    }

    private List<Suggestion> checkTimeBasedSuggestions(DevelopmentStatus status, WorkContext context,
                                                       EffectiveSuggestionConfig config, Instant now) {
        Instant since = context.getUncommittedStartTime();
        if (since == null || !status.hasUncommittedChanges()) {
            return List.of();
        }
        Duration uncommitted = Duration.between(since, now);
        long minutes = uncommitted.toMinutes();
        if (uncommitted.compareTo(Duration.ofMinutes(config.warningThresholdMinutes())) > 0) {
            return List.of(Suggestion.rule(SuggestionType.CHECKPOINT, Priority.HIGH,
                    "You have uncommitted changes for over " + describeDuration(minutes),
                    "dev_checkpoint",
                    "Commit regularly so work can be recovered."));
        }
        if (uncommitted.compareTo(Duration.ofMinutes(config.reminderThresholdMinutes())) > 0) {
            return List.of(Suggestion.rule(SuggestionType.CHECKPOINT, Priority.MEDIUM,
                    "Consider committing your progress",
                    "dev_checkpoint",
                    "Regular commits make it easier to track your work and collaborate."));
        }
        return List.of();
    }

    private List<Suggestion> checkChangePatterns(DevelopmentStatus status) {
        UncommittedChanges changes = status.uncommittedChanges();
        if (changes == null || changes.filesChanged().isEmpty()) {
            return List.of();
        }
        List<String> files = changes.filesChanged().stream().map(FileChange::file).toList();
        List<Suggestion> suggestions = new ArrayList<>();

        boolean hasTests = files.stream().anyMatch(SuggestionEngine::isTestFile);
        boolean hasImplementation = files.stream().anyMatch(f -> !isTestFile(f));
        if (hasTests && hasImplementation) {
            suggestions.add(Suggestion.rule(SuggestionType.COMMIT, Priority.LOW,
                    "You have both implementation and test changes", null,
                    "Consider committing them together to keep coverage in step."));
        }

        boolean hasDocs = files.stream().anyMatch(f -> f.endsWith(".md") || f.contains("docs/"));
        boolean hasCode = files.stream().anyMatch(SuggestionEngine::isCodeFile);
        if (hasDocs && hasCode) {
            suggestions.add(Suggestion.rule(SuggestionType.COMMIT, Priority.LOW,
                    "Documentation is updated along with code", null,
                    "Docs and code changed together."));
        }
        return suggestions;
    }

    private List<Suggestion> checkBranchSuggestions(DevelopmentStatus status) {
        UncommittedChanges changes = status.uncommittedChanges();
        if (changes == null || !gitWorkflow.getMainBranch().equals(status.branch())) {
            return List.of();
        }
        boolean addsFeature = changes.filesChanged().stream()
                .anyMatch(f -> f.status() == FileStatus.ADDED
                        && FEATURE_DIRECTORIES.stream().anyMatch(dir -> f.file().contains(dir)));
        if (!addsFeature) {
            return List.of();
        }
        return List.of(Suggestion.rule(SuggestionType.BRANCH, Priority.HIGH,
                "You appear to be adding new features on the main branch",
                "dev_create_branch",
                "New features belong in feature branches for easier review and rollback."));
    }

    private List<Suggestion> checkPrReadiness(DevelopmentStatus status) {
        if (gitWorkflow.getMainBranch().equals(status.branch()) || status.isProtected()
                || status.hasUncommittedChanges()) {
            return List.of();
        }
        return List.of(Suggestion.rule(SuggestionType.PR, Priority.MEDIUM,
                "Your branch appears ready for a pull request",
                "dev_create_pull_request",
                "Clean working directory on a feature branch."));
    }

    // ---- Helpers ----

    /**
     * Keeps the first suggestion per type and action. Agent suggestions are added first, so they win.
     */
    private static List<Suggestion> deduplicate(List<Suggestion> suggestions) {
        Map<String, Suggestion> unique = new LinkedHashMap<>();
        for (Suggestion suggestion : suggestions) {
            unique.putIfAbsent(suggestion.key(), suggestion);
        }
        return new ArrayList<>(unique.values());
    }

    private static boolean isTestFile(String file) {
        String lower = file.toLowerCase(Locale.ROOT);
        return lower.contains("test") || lower.contains("spec") || lower.contains("__tests__");
    }

    private static boolean isCodeFile(String file) {
        int dot = file.lastIndexOf('.');
        return dot >= 0 && CODE_EXTENSIONS.contains(file.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String describeDuration(long minutes) {
        if (minutes >= 120) {
            return (minutes / 60) + " hours";
        }
        return minutes + " minutes";
    }
}
