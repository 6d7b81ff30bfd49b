package com.devflow.core.safety;

/**
 * Runs a project's tests on demand.
 */
public interface TestCheck {

    /**
     * @return true when the test run succeeded
     * @throws com.devflow.core.llm.LlmTimeoutException when the run exceeds its time bound
     */
    boolean testsPass(String projectPath);
}
