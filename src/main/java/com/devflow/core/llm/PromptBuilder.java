package com.devflow.core.llm;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.model.DecisionAction;
import com.devflow.core.model.DecisionContext;
import com.devflow.core.model.MonitoringEvent;
import com.devflow.core.model.ProjectState;
import com.devflow.core.model.TimeContext;
import com.devflow.core.model.UserPreferences;
import com.devflow.core.model.WorkingHours;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the chat messages for every decision-agent request.
 * Pure apart from reading the clock for relative times.
 */
@Component
public class PromptBuilder {

    private static final int HISTORY_IN_PROMPT = 5;
    private static final int COMMITS_IN_PROMPT = 5;

    private final AutomationProperties automation;
    private final Clock clock;

    public PromptBuilder(AutomationProperties automation, Clock clock) {
        this.automation = automation;
        this.clock = clock;
    }

    public List<LlmMessage> buildDecisionPrompt(DecisionContext context) {
        return List.of(
                LlmMessage.system(decisionSystemPrompt(context.userPreferences())),
                LlmMessage.user(decisionUserPrompt(context)));
    }

    public List<LlmMessage> buildCommitMessagePrompt(String diffSummary, ProjectState state, List<String> recentCommits) {
        String style = automation.getPreferences().getCommitStyle();
        var system = new StringBuilder();
        system.append("You are a Git commit message generator. Generate professional commit messages following the ")
                .append(style).append(" style.\n\n");
        system.append("Rules:\n");
        system.append("1. Keep the first line under 72 characters\n");
        system.append("2. Use active voice and present tense\n");
        system.append("3. Be specific about what changed and why\n");
        system.append("4. Follow the repository's existing commit style\n");
        if ("conventional".equalsIgnoreCase(style)) {
            system.append("5. Use conventional commit format (type: subject)\n");
        }

        var user = new StringBuilder();
        user.append("Generate a commit message for the following changes:\n\n");
        user.append("DIFF SUMMARY:\n").append(diffSummary).append("\n\n");
        user.append("PROJECT INFO:\n");
        user.append("- Branch: ").append(state.branch()).append("\n");
        user.append("- Test Status: ").append(state.testStatus().value()).append("\n\n");
        user.append("RECENT COMMITS (for style reference):\n");
        user.append(String.join("\n", recentCommits.subList(0, Math.min(COMMITS_IN_PROMPT, recentCommits.size()))));
        user.append("\n\nGenerate a commit message following the team's style. Reply with the message only.");

        return List.of(LlmMessage.system(system.toString()), LlmMessage.user(user.toString()));
    }

    public List<LlmMessage> buildPrDescriptionPrompt(String branchName, List<String> commits, String changesSummary) {
        String system = "You are a GitHub Pull Request description generator. Create comprehensive PR descriptions "
                + "that help reviewers understand the changes.\n\n"
                + "Output format: JSON with \"title\" and \"body\" fields.";

        var user = new StringBuilder();
        user.append("Create a pull request description:\n\n");
        user.append("BRANCH: ").append(branchName).append("\n");
        user.append("COMMITS:\n").append(String.join("\n", commits)).append("\n\n");
        user.append("CHANGES SUMMARY:\n").append(changesSummary).append("\n\n");
        user.append("Generate a JSON response with:\n");
        user.append("- title: Clear, concise PR title\n");
        user.append("- body: Comprehensive description including summary, motivation, type of change, and testing performed");

        return List.of(LlmMessage.system(system), LlmMessage.user(user.toString()));
    }

    public List<LlmMessage> buildRiskAssessmentPrompt(DecisionContext context) {
        String system = "You are a risk assessment system for Git automation. Evaluate the risk level of proposed actions.\n\n"
                + "Output format: JSON with score (0-1), factors (array), level (low/medium/high/critical), "
                + "and requiresApproval (boolean).";

        ProjectState state = context.projectState();
        TimeContext time = context.timeContext();
        var user = new StringBuilder();
        user.append("Assess the risk of this action:\n\n");
        user.append("ACTION: ").append(context.currentEvent().type().value()).append("\n");
        user.append("PROJECT STATE:\n");
        user.append("- Branch: ").append(state.branch()).append("\n");
        user.append("- Protected: ").append(state.isProtected()).append("\n");
        user.append("- Uncommitted Changes: ").append(state.uncommittedChanges()).append("\n");
        user.append("- Tests: ").append(state.testStatus().value()).append("\n\n");
        user.append("TIME CONTEXT:\n");
        user.append("- Current Time: ").append(time != null ? time.currentTime() : "unknown").append("\n");
        user.append("- Working Hours: ").append(time != null ? time.isWorkingHours() : "unknown").append("\n\n");
        user.append("Evaluate risk considering branch protection, test status, time of day, and change scope.");

        return List.of(LlmMessage.system(system), LlmMessage.user(user.toString()));
    }

    private String decisionSystemPrompt(UserPreferences preferences) {
        AutomationProperties.Thresholds thresholds = automation.getThresholds();
        WorkingHours hours = preferences.workingHours();

        var sb = new StringBuilder();
        sb.append("You are an intelligent Git workflow assistant that makes decisions about when and how to perform Git operations.\n\n");
        sb.append("Your role:\n");
        sb.append("1. Analyze the current development context\n");
        sb.append("2. Decide what action to take (if any)\n");
        sb.append("3. Provide clear reasoning for your decision\n");
        sb.append("4. Assess confidence level (0-1)\n");
        sb.append("5. Determine if manual approval is needed\n\n");

        sb.append("User Preferences:\n");
        sb.append("- Commit Style: ").append(preferences.commitStyle()).append("\n");
        sb.append("- Commit Frequency: ").append(preferences.commitFrequency()).append("\n");
        sb.append("- Risk Tolerance: ").append(preferences.riskTolerance()).append("\n");
        sb.append("- Working Hours: ")
                .append(hours != null ? hours.start() + "-" + hours.end() : "Not specified").append("\n\n");

        sb.append("Safety Rules:\n");
        sb.append("- Never auto-execute if confidence < ").append(thresholds.getAutoExecute()).append("\n");
        sb.append("- Always require approval if confidence < ").append(thresholds.getRequireApproval()).append("\n");
        sb.append("- Respect protected branches and files\n");
        sb.append("- Consider test status when available\n\n");

        sb.append("Output Format: JSON with fields:\n");
        sb.append("{\n");
        sb.append("  \"action\": \"").append(actionList()).append("\",\n");
        sb.append("  \"confidence\": 0.0-1.0,\n");
        sb.append("  \"reasoning\": \"explanation of decision\",\n");
        sb.append("  \"requiresApproval\": true/false,\n");
        sb.append("  \"alternativeActions\": [\"other viable options\"],\n");
        sb.append("  \"riskAssessment\": { optional risk details }\n");
        sb.append("}");
        return sb.toString();
    }

    private String decisionUserPrompt(DecisionContext context) {
        MonitoringEvent event = context.currentEvent();
        ProjectState state = context.projectState();
        TimeContext time = context.timeContext();
        List<MonitoringEvent> history = context.recentHistory();
        List<MonitoringEvent> shownHistory = history.subList(Math.max(0, history.size() - HISTORY_IN_PROMPT), history.size());

        var sb = new StringBuilder();
        sb.append("Analyze the current situation and decide what action to take:\n\n");

        sb.append("CURRENT EVENT:\n");
        sb.append("- Type: ").append(event.type().value()).append("\n");
        sb.append("- Description: ").append(describe(event)).append("\n");
        sb.append("- Timestamp: ").append(event.timestamp()).append("\n\n");

        sb.append("PROJECT STATE:\n");
        sb.append("- Branch: ").append(state.branch()).append("\n");
        sb.append("- Protected: ").append(state.isProtected()).append("\n");
        sb.append("- Uncommitted Changes: ").append(state.uncommittedChanges()).append(" files\n");
        sb.append("- Last Commit: ").append(state.lastCommitTime() != null ? timeSince(state.lastCommitTime()) : "unknown").append("\n");
        sb.append("- Test Status: ").append(state.testStatus().value()).append("\n");
        sb.append("- Build Status: ").append(state.buildStatus().value()).append("\n\n");

        sb.append("RECENT HISTORY:\n");
        sb.append(shownHistory.stream()
                .map(e -> "- " + timeSince(e.timestamp()) + ": " + describe(e))
                .collect(Collectors.joining("\n")));
        sb.append("\n\n");

        sb.append("AVAILABLE ACTIONS:\n");
        sb.append(context.possibleActions().stream().map(DecisionAction::value).collect(Collectors.joining(", ")));
        sb.append("\n\n");

        sb.append("TIME CONTEXT:\n");
        sb.append("- Current Time: ").append(time != null ? time.currentTime() : "unknown").append("\n");
        sb.append("- Is Working Hours: ").append(time != null ? time.isWorkingHours() : "unknown").append("\n");
        sb.append("- Last User Activity: ")
                .append(time != null && time.lastUserActivity() != null ? timeSince(time.lastUserActivity()) : "unknown")
                .append("\n\n");

        sb.append("Based on the user's preferences and current context, what action should be taken?");
        return sb.toString();
    }

    /**
     * Short human description of an event for prompt text.
     */
    String describe(MonitoringEvent event) {
        return switch (event.type()) {
            case FILE_CHANGE -> "Files changed: " + event.files().size();
            case GIT_STATE_CHANGE -> event.files().size() > 5
                    ? "Large number of changes accumulated"
                    : event.description();
            case FEATURE_COMPLETE -> "Feature appears to be complete";
            case TESTS_PASSING -> "All tests are passing";
            case TESTS_FAILING -> "Tests are failing";
            case REFACTOR_COMPLETE -> "Refactoring completed";
            case DOCS_UPDATED -> "Documentation updated";
            default -> event.type().value();
        };
    }

    /**
     * Renders the time elapsed since {@code instant} as "just now", "N minutes ago", "N hours ago" or "N days ago".
     */
    String timeSince(Instant instant) {
        Duration elapsed = Duration.between(instant, clock.instant());
        long minutes = Math.max(0, elapsed.toMinutes());
        long hours = minutes / 60;
        long days = hours / 24;
        if (days > 0) {
            return plural(days, "day") + " ago";
        }
        if (hours > 0) {
            return plural(hours, "hour") + " ago";
        }
        if (minutes > 0) {
            return plural(minutes, "minute") + " ago";
        }
        return "just now";
    }

    private static String plural(long count, String unit) {
        return count + " " + unit + (count > 1 ? "s" : "");
    }

    private static String actionList() {
        return Arrays.stream(DecisionAction.values())
                .map(DecisionAction::value)
                .collect(Collectors.joining("|"));
    }
}
