package com.devflow.core.suggestion;

/**
 * Suggestion settings for one project after merging its overrides over the global defaults.
 */
public record EffectiveSuggestionConfig(
    boolean enabled,
    boolean protectedBranchWarnings,
    boolean timeRemindersEnabled,
    int warningThresholdMinutes,
    int reminderThresholdMinutes,
    boolean largeChangesetEnabled,
    int largeChangesetThreshold,
    boolean patternRecognition,
    boolean prSuggestions,
    boolean changePatternSuggestions,
    boolean branchSuggestions
) {}
