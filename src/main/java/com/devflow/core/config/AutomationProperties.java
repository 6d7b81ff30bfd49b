package com.devflow.core.config;

import com.devflow.core.model.UserPreferences;
import com.devflow.core.model.WorkingHours;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Read-only automation settings. Validity is checked upstream before binding.
 */
@Component
@ConfigurationProperties(prefix = "devflow.automation")
public class AutomationProperties {

    private boolean enabled = false;
    private AutomationMode mode = AutomationMode.ASSISTED;
    private Llm llm = new Llm();
    private Thresholds thresholds = new Thresholds();
    private Preferences preferences = new Preferences();
    private Safety safety = new Safety();
    private Learning learning = new Learning();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public AutomationMode getMode() { return mode; }
    public void setMode(AutomationMode mode) { this.mode = mode; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }
    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }
    public Preferences getPreferences() { return preferences; }
    public void setPreferences(Preferences preferences) { this.preferences = preferences; }
    public Safety getSafety() { return safety; }
    public void setSafety(Safety safety) { this.safety = safety; }
    public Learning getLearning() { return learning; }
    public void setLearning(Learning learning) { this.learning = learning; }

    /**
     * True when automation is switched on and the mode is anything but {@link AutomationMode#OFF}.
     */
    public boolean isActive() {
        return enabled && mode != AutomationMode.OFF;
    }

    public static class Llm {
        private String provider = "openai";
        private String model = "";
        private double temperature = 0.3;
        private int maxTokens = 1024;
        private int timeoutSeconds = 30;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    }

    public static class Thresholds {
        /** Minimum confidence below which a decision always needs approval. */
        private double confidence = 0.7;
        /** Minimum confidence for autonomous execution. */
        private double autoExecute = 0.9;
        /** Below this, the model is told not to suggest at all. */
        private double requireApproval = 0.5;

        public double getConfidence() { return confidence; }
        public void setConfidence(double confidence) { this.confidence = confidence; }
        public double getAutoExecute() { return autoExecute; }
        public void setAutoExecute(double autoExecute) { this.autoExecute = autoExecute; }
        public double getRequireApproval() { return requireApproval; }
        public void setRequireApproval(double requireApproval) { this.requireApproval = requireApproval; }
    }

    public static class Preferences {
        private String commitStyle = "conventional";
        private String commitFrequency = "moderate";
        private WorkingHoursWindow workingHours;
        private String riskTolerance = "medium";

        public String getCommitStyle() { return commitStyle; }
        public void setCommitStyle(String commitStyle) { this.commitStyle = commitStyle; }
        public String getCommitFrequency() { return commitFrequency; }
        public void setCommitFrequency(String commitFrequency) { this.commitFrequency = commitFrequency; }
        public WorkingHoursWindow getWorkingHours() { return workingHours; }
        public void setWorkingHours(WorkingHoursWindow workingHours) { this.workingHours = workingHours; }
        public String getRiskTolerance() { return riskTolerance; }
        public void setRiskTolerance(String riskTolerance) { this.riskTolerance = riskTolerance; }

        public UserPreferences toUserPreferences() {
            WorkingHours hours = workingHours == null ? null
                    : new WorkingHours(workingHours.getStart(), workingHours.getEnd(), workingHours.getTimezone());
            return new UserPreferences(commitStyle, commitFrequency, hours, riskTolerance);
        }
    }

    public static class WorkingHoursWindow {
        private String start = "09:00";
        private String end = "18:00";
        private String timezone;

        public String getStart() { return start; }
        public void setStart(String start) { this.start = start; }
        public String getEnd() { return end; }
        public void setEnd(String end) { this.end = end; }
        public String getTimezone() { return timezone; }
        public void setTimezone(String timezone) { this.timezone = timezone; }
    }

    public static class Safety {
        private int maxActionsPerHour = 10;
        private List<String> protectedFiles = List.of();
        private boolean requireTestsPass = false;
        private boolean pauseOnErrors = true;
        private boolean emergencyStop = false;
        private String testCommand = "mvn -q test";
        private int testTimeoutSeconds = 300;

        public int getMaxActionsPerHour() { return maxActionsPerHour; }
        public void setMaxActionsPerHour(int maxActionsPerHour) { this.maxActionsPerHour = maxActionsPerHour; }
        public List<String> getProtectedFiles() { return protectedFiles; }
        public void setProtectedFiles(List<String> protectedFiles) { this.protectedFiles = protectedFiles; }
        public boolean isRequireTestsPass() { return requireTestsPass; }
        public void setRequireTestsPass(boolean requireTestsPass) { this.requireTestsPass = requireTestsPass; }
        public boolean isPauseOnErrors() { return pauseOnErrors; }
        public void setPauseOnErrors(boolean pauseOnErrors) { this.pauseOnErrors = pauseOnErrors; }
        public boolean isEmergencyStop() { return emergencyStop; }
        public void setEmergencyStop(boolean emergencyStop) { this.emergencyStop = emergencyStop; }
        public String getTestCommand() { return testCommand; }
        public void setTestCommand(String testCommand) { this.testCommand = testCommand; }
        public int getTestTimeoutSeconds() { return testTimeoutSeconds; }
        public void setTestTimeoutSeconds(int testTimeoutSeconds) { this.testTimeoutSeconds = testTimeoutSeconds; }
    }

    public static class Learning {
        private boolean enabled = false;
        private boolean storeFeedback = true;
        private boolean adaptToPatterns = true;
        private boolean preferenceLearning = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isStoreFeedback() { return storeFeedback; }
        public void setStoreFeedback(boolean storeFeedback) { this.storeFeedback = storeFeedback; }
        public boolean isAdaptToPatterns() { return adaptToPatterns; }
        public void setAdaptToPatterns(boolean adaptToPatterns) { this.adaptToPatterns = adaptToPatterns; }
        public boolean isPreferenceLearning() { return preferenceLearning; }
        public void setPreferenceLearning(boolean preferenceLearning) { this.preferenceLearning = preferenceLearning; }
    }
}
