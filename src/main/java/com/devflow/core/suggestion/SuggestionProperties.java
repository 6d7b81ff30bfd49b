package com.devflow.core.suggestion;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Global suggestion defaults plus per-project overrides.
 * <p>
 * Overrides are resolved leaf by leaf: a project that only sets
 * {@code time-reminders.warning-threshold-minutes} keeps every other global value.
 */
@Component
@ConfigurationProperties(prefix = "devflow.suggestions")
public class SuggestionProperties {

    private boolean enabled = true;
    private boolean protectedBranchWarnings = true;
    private TimeReminders timeReminders = new TimeReminders();
    private LargeChangeset largeChangeset = new LargeChangeset();
    private boolean patternRecognition = true;
    private boolean prSuggestions = true;
    private boolean changePatternSuggestions = true;
    private boolean branchSuggestions = true;
    private Map<String, ProjectOverrides> projects = new HashMap<>();

    /**
     * Merges the overrides configured for {@code projectPath} over the global defaults.
     */
    public EffectiveSuggestionConfig resolve(String projectPath) {
        ProjectOverrides o = projects.getOrDefault(projectPath, new ProjectOverrides());
        TimeRemindersOverrides tr = o.getTimeReminders() != null ? o.getTimeReminders() : new TimeRemindersOverrides();
        LargeChangesetOverrides lc = o.getLargeChangeset() != null ? o.getLargeChangeset() : new LargeChangesetOverrides();
        return new EffectiveSuggestionConfig(
                pick(o.getEnabled(), enabled),
                pick(o.getProtectedBranchWarnings(), protectedBranchWarnings),
                pick(tr.getEnabled(), timeReminders.isEnabled()),
                pick(tr.getWarningThresholdMinutes(), timeReminders.getWarningThresholdMinutes()),
                pick(tr.getReminderThresholdMinutes(), timeReminders.getReminderThresholdMinutes()),
                pick(lc.getEnabled(), largeChangeset.isEnabled()),
                pick(lc.getThreshold(), largeChangeset.getThreshold()),
                pick(o.getPatternRecognition(), patternRecognition),
                pick(o.getPrSuggestions(), prSuggestions),
                pick(o.getChangePatternSuggestions(), changePatternSuggestions),
                pick(o.getBranchSuggestions(), branchSuggestions));
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean isProtectedBranchWarnings() { return protectedBranchWarnings; }
    public void setProtectedBranchWarnings(boolean protectedBranchWarnings) { this.protectedBranchWarnings = protectedBranchWarnings; }
    public TimeReminders getTimeReminders() { return timeReminders; }
    public void setTimeReminders(TimeReminders timeReminders) { this.timeReminders = timeReminders; }
    public LargeChangeset getLargeChangeset() { return largeChangeset; }
    public void setLargeChangeset(LargeChangeset largeChangeset) { this.largeChangeset = largeChangeset; }
    public boolean isPatternRecognition() { return patternRecognition; }
    public void setPatternRecognition(boolean patternRecognition) { this.patternRecognition = patternRecognition; }
    public boolean isPrSuggestions() { return prSuggestions; }
    public void setPrSuggestions(boolean prSuggestions) { this.prSuggestions = prSuggestions; }
    public boolean isChangePatternSuggestions() { return changePatternSuggestions; }
    public void setChangePatternSuggestions(boolean changePatternSuggestions) { this.changePatternSuggestions = changePatternSuggestions; }
    public boolean isBranchSuggestions() { return branchSuggestions; }
    public void setBranchSuggestions(boolean branchSuggestions) { this.branchSuggestions = branchSuggestions; }
    public Map<String, ProjectOverrides> getProjects() { return projects; }
    public void setProjects(Map<String, ProjectOverrides> projects) { this.projects = projects; }

    public static class TimeReminders {
        private boolean enabled = true;
        private int warningThresholdMinutes = 120;
        private int reminderThresholdMinutes = 60;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getWarningThresholdMinutes() { return warningThresholdMinutes; }
        public void setWarningThresholdMinutes(int warningThresholdMinutes) { this.warningThresholdMinutes = warningThresholdMinutes; }
        public int getReminderThresholdMinutes() { return reminderThresholdMinutes; }
        public void setReminderThresholdMinutes(int reminderThresholdMinutes) { this.reminderThresholdMinutes = reminderThresholdMinutes; }
    }

    public static class LargeChangeset {
        private boolean enabled = true;
        private int threshold = 5;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getThreshold() { return threshold; }
        public void setThreshold(int threshold) { this.threshold = threshold; }
    }

    /** Per-project overrides; {@code null} leaves inherit the global value. */
    public static class ProjectOverrides {
        private Boolean enabled;
        private Boolean protectedBranchWarnings;
        private TimeRemindersOverrides timeReminders;
        private LargeChangesetOverrides largeChangeset;
        private Boolean patternRecognition;
        private Boolean prSuggestions;
        private Boolean changePatternSuggestions;
        private Boolean branchSuggestions;

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
        public Boolean getProtectedBranchWarnings() { return protectedBranchWarnings; }
        public void setProtectedBranchWarnings(Boolean protectedBranchWarnings) { this.protectedBranchWarnings = protectedBranchWarnings; }
        public TimeRemindersOverrides getTimeReminders() { return timeReminders; }
        public void setTimeReminders(TimeRemindersOverrides timeReminders) { this.timeReminders = timeReminders; }
        public LargeChangesetOverrides getLargeChangeset() { return largeChangeset; }
        public void setLargeChangeset(LargeChangesetOverrides largeChangeset) { this.largeChangeset = largeChangeset; }
        public Boolean getPatternRecognition() { return patternRecognition; }
        public void setPatternRecognition(Boolean patternRecognition) { this.patternRecognition = patternRecognition; }
        public Boolean getPrSuggestions() { return prSuggestions; }
        public void setPrSuggestions(Boolean prSuggestions) { this.prSuggestions = prSuggestions; }
        public Boolean getChangePatternSuggestions() { return changePatternSuggestions; }
        public void setChangePatternSuggestions(Boolean changePatternSuggestions) { this.changePatternSuggestions = changePatternSuggestions; }
        public Boolean getBranchSuggestions() { return branchSuggestions; }
        public void setBranchSuggestions(Boolean branchSuggestions) { this.branchSuggestions = branchSuggestions; }
    }

    public static class TimeRemindersOverrides {
        private Boolean enabled;
        private Integer warningThresholdMinutes;
        private Integer reminderThresholdMinutes;

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
        public Integer getWarningThresholdMinutes() { return warningThresholdMinutes; }
        public void setWarningThresholdMinutes(Integer warningThresholdMinutes) { this.warningThresholdMinutes = warningThresholdMinutes; }
        public Integer getReminderThresholdMinutes() { return reminderThresholdMinutes; }
        public void setReminderThresholdMinutes(Integer reminderThresholdMinutes) { this.reminderThresholdMinutes = reminderThresholdMinutes; }
    }

    public static class LargeChangesetOverrides {
        private Boolean enabled;
        private Integer threshold;

        public Boolean getEnabled() { return enabled; }
        public void setEnabled(Boolean enabled) { this.enabled = enabled; }
        public Integer getThreshold() { return threshold; }
        public void setThreshold(Integer threshold) { this.threshold = threshold; }
    }
}
