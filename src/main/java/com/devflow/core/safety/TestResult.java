package com.devflow.core.safety;

/**
 * Outcome of a test command run for the safety gate.
 */
public record TestResult(
    String projectPath,
    boolean passed,
    int totalTests,
    int failedTests,
    String output,
    long durationMs
) {}
