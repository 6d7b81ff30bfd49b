package com.devflow.core.safety;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.llm.LlmTimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs real processes, so only on POSIX systems.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandTestCheckTest {

    @TempDir
    Path projectDir;

    private CommandTestCheck check(String command, int timeoutSeconds) {
        var automation = new AutomationProperties();
        automation.getSafety().setTestCommand(command);
        automation.getSafety().setTestTimeoutSeconds(timeoutSeconds);
        return new CommandTestCheck(automation);
    }

    @Test
    @DisplayName("a successful command passes")
    void success() {
        assertTrue(check("true", 10).testsPass(projectDir.toString()));
    }

    @Test
    @DisplayName("a failing command fails")
    void failure() {
        assertFalse(check("false", 10).testsPass(projectDir.toString()));
    }

    @Test
    @DisplayName("output is captured and parsed")
    void parsesOutput() {
        TestResult result = check("echo Tests run: 7, Failures: 0, Errors: 0", 10).run(projectDir.toString());

        assertTrue(result.passed());
        assertEquals(7, result.totalTests());
    }

    @Test
    @DisplayName("a command exceeding the timeout is killed")
    void timeout() {
        assertThrows(LlmTimeoutException.class, () -> check("sleep 5", 1).testsPass(projectDir.toString()));
    }
}
