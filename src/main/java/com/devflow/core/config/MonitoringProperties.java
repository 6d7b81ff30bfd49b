package com.devflow.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the monitoring pipeline: monitored projects and buffer bounds.
 */
@Component
@ConfigurationProperties(prefix = "devflow.monitoring")
public class MonitoringProperties {

    private List<Project> projects = new ArrayList<>();
    /** Uncommitted file count at which a git state change produces a commit suggestion. */
    private int commitThreshold = 10;
    private int maxBufferedEvents = 1000;
    private int maxBufferedMessages = 100;
    private int milestoneWindowMinutes = 5;
    private int suggestionCooldownMinutes = 10;
    private int recentHistorySize = 10;
    private int gitPollSeconds = 30;

    public List<Project> getProjects() { return projects; }
    public void setProjects(List<Project> projects) { this.projects = projects; }
    public int getCommitThreshold() { return commitThreshold; }
    public void setCommitThreshold(int commitThreshold) { this.commitThreshold = commitThreshold; }
    public int getMaxBufferedEvents() { return maxBufferedEvents; }
    public void setMaxBufferedEvents(int maxBufferedEvents) { this.maxBufferedEvents = maxBufferedEvents; }
    public int getMaxBufferedMessages() { return maxBufferedMessages; }
    public void setMaxBufferedMessages(int maxBufferedMessages) { this.maxBufferedMessages = maxBufferedMessages; }
    public int getMilestoneWindowMinutes() { return milestoneWindowMinutes; }
    public void setMilestoneWindowMinutes(int milestoneWindowMinutes) { this.milestoneWindowMinutes = milestoneWindowMinutes; }
    public int getSuggestionCooldownMinutes() { return suggestionCooldownMinutes; }
    public void setSuggestionCooldownMinutes(int suggestionCooldownMinutes) { this.suggestionCooldownMinutes = suggestionCooldownMinutes; }
    public int getRecentHistorySize() { return recentHistorySize; }
    public void setRecentHistorySize(int recentHistorySize) { this.recentHistorySize = recentHistorySize; }
    public int getGitPollSeconds() { return gitPollSeconds; }
    public void setGitPollSeconds(int gitPollSeconds) { this.gitPollSeconds = gitPollSeconds; }

    public static class Project {
        private String path;
        private String githubRepo;

        public Project() {}

        public Project(String path, String githubRepo) {
            this.path = path;
            this.githubRepo = githubRepo;
        }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
        public String getGithubRepo() { return githubRepo; }
        public void setGithubRepo(String githubRepo) { this.githubRepo = githubRepo; }
    }
}
