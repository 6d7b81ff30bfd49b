package com.devflow.core.model;

import java.util.List;

/**
 * State snapshot bundled into a single decision request.
 *
 * @param currentEvent    event that triggered the decision
 * @param projectState    project snapshot
 * @param recentHistory   recent events of the same project, oldest first
 * @param userPreferences preferences forwarded into the prompt
 * @param possibleActions actions the model may choose from
 * @param timeContext     time information, {@code null} to let the agent compute it
 */
public record DecisionContext(
    MonitoringEvent currentEvent,
    ProjectState projectState,
    List<MonitoringEvent> recentHistory,
    UserPreferences userPreferences,
    List<DecisionAction> possibleActions,
    TimeContext timeContext
) {

    public DecisionContext {
        recentHistory = recentHistory == null ? List.of() : List.copyOf(recentHistory);
        possibleActions = possibleActions == null ? List.of() : List.copyOf(possibleActions);
        userPreferences = userPreferences == null ? UserPreferences.defaults() : userPreferences;
    }

    public String projectPath() {
        return currentEvent.projectPath();
    }
}
