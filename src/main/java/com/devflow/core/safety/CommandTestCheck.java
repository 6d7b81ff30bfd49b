package com.devflow.core.safety;

import com.devflow.core.config.AutomationProperties;
import com.devflow.core.llm.LlmTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link TestCheck}: runs {@code devflow.automation.safety.test-command} in the project
 * directory and interprets its output. The process is killed when it exceeds
 * {@code test-timeout-seconds}.
 */
@Component
public class CommandTestCheck implements TestCheck {

    private static final Logger log = LoggerFactory.getLogger(CommandTestCheck.class);

    private final AutomationProperties.Safety safety;

    public CommandTestCheck(AutomationProperties automation) {
        this.safety = automation.getSafety();
    }

    @Override
    public boolean testsPass(String projectPath) {
        return run(projectPath).passed();
    }

    public TestResult run(String projectPath) {
        List<String> command = Arrays.asList(safety.getTestCommand().trim().split("\\s+"));
        long start = System.currentTimeMillis();
        Path outputFile = null;
        try {
            outputFile = Files.createTempFile("devflow-tests", ".log");
            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile());
            if (projectPath != null && !projectPath.isBlank()) {
                builder.directory(new File(projectPath));
            }

            log.info("Running tests for {}: {}", projectPath, String.join(" ", command));
            Process process = builder.start();
            if (!process.waitFor(safety.getTestTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new LlmTimeoutException("Test command timed out after " + safety.getTestTimeoutSeconds() + "s");
            }

            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            TestResult result = TestOutputParser.parse(projectPath, output, process.exitValue(),
                    System.currentTimeMillis() - start);
            log.info("Tests for {} {} in {} ms", projectPath, result.passed() ? "passed" : "failed", result.durationMs());
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run test command for " + projectPath, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running tests for " + projectPath, e);
        } finally {
            deleteQuietly(outputFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete test output file {}: {}", file, e.getMessage());
        }
    }
}
