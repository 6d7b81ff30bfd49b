package com.devflow.core.safety;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Interprets the console output of a test command.
 */
public final class TestOutputParser {

    private static final Logger log = LoggerFactory.getLogger(TestOutputParser.class);

    /** Maven Surefire / JUnit style: "Tests run: 10, Failures: 2, Errors: 1". The last match is the summary. */
    private static final Pattern MAVEN_PATTERN =
            Pattern.compile("Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+)(?:,\\s*Errors:\\s*(\\d+))?");

    /** pytest style: "8 passed, 2 failed" or "8 passed" */
    private static final Pattern PYTEST_PASSED_PATTERN = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED_PATTERN = Pattern.compile("(\\d+)\\s+failed");

    private static final Pattern BUILD_FAILURE_PATTERN =
            Pattern.compile("(?i)(BUILD FAILURE|BUILD FAILED|COMPILATION ERROR|npm ERR!)");

    private TestOutputParser() {}

    /**
     * A non-zero exit code always fails. Otherwise recognised framework summaries decide,
     * then build-failure markers; output without either counts as passed.
     */
    public static TestResult parse(String projectPath, String output, int exitCode, long durationMs) {
        String text = output != null ? output : "";

        int total = 0;
        int failed = 0;
        boolean summaryFound = false;

        Matcher maven = MAVEN_PATTERN.matcher(text);
        while (maven.find()) {
            summaryFound = true;
            total = Integer.parseInt(maven.group(1));
            failed = Integer.parseInt(maven.group(2))
                    + (maven.group(3) != null ? Integer.parseInt(maven.group(3)) : 0);
        }

        if (!summaryFound) {
            Matcher passedMatcher = PYTEST_PASSED_PATTERN.matcher(text);
            Matcher failedMatcher = PYTEST_FAILED_PATTERN.matcher(text);
            boolean foundPassed = passedMatcher.find();
            boolean foundFailed = failedMatcher.find();
            if (foundPassed || foundFailed) {
                summaryFound = true;
                int passedCount = foundPassed ? Integer.parseInt(passedMatcher.group(1)) : 0;
                failed = foundFailed ? Integer.parseInt(failedMatcher.group(1)) : 0;
                total = passedCount + failed;
            }
        }

        boolean passed;
        if (exitCode != 0) {
            passed = false;
        } else if (summaryFound) {
            passed = failed == 0;
        } else {
            passed = !BUILD_FAILURE_PATTERN.matcher(text).find();
        }
        log.debug("Test output for {}: exit={}, {}/{} failed, passed={}", projectPath, exitCode, failed, total, passed);
        return new TestResult(projectPath, passed, total, failed, text, durationMs);
    }
}
