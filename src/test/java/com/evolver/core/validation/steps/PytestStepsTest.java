package com.evolver.core.validation.steps;

import com.evolver.core.model.PatchInstruction;
import com.evolver.core.process.RecordingProcessRunner;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationReasons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PytestStepsTest {

    @TempDir
    Path base;

    private RecordingProcessRunner runner;

    @BeforeEach
    void setUp() {
        runner = new RecordingProcessRunner();
    }

    @Nested
    class RunPytest {

        private PytestValidationStep step(boolean inSandbox) {
            return new PytestValidationStep(new StepContext(base, List.of(), inSandbox), runner,
                    "python3", "tests/", Duration.ofSeconds(5));
        }

        @Test
        void passingSuiteSucceeds() {
            var result = step(false).execute();

            assertTrue(result.success());
            assertEquals(ValidationReasons.PYTEST_SUCCESS, result.reasonCode());
            assertEquals(List.of("python3", "-m", "pytest", "tests/"), runner.lastCommand());
        }

        @Test
        void failingSuiteReportsOutput() {
            runner.willReturn(1, "1 failed, 3 passed");

            var result = step(false).execute();

            assertFalse(result.success());
            assertEquals(ValidationReasons.PYTEST_FAILURE, result.reasonCode());
            assertEquals("1 failed, 3 passed", result.details());
        }

        @Test
        void failureInSandboxIsQualified() {
            runner.willReturn(2, "error");

            assertEquals("PYTEST_FAILURE_IN_SANDBOX", step(true).execute().reasonCode());
        }
    }

    @Nested
    class RunPytestNewFile {

        private PytestNewFileStep step(List<PatchInstruction> patches) {
            return new PytestNewFileStep(new StepContext(base, patches, true), runner, "python3", Duration.ofSeconds(5));
        }

        @Test
        void runsOnlyTheNewTestFile() throws IOException {
            Files.createDirectories(base.resolve("tests"));
            Files.writeString(base.resolve("tests/test_new.py"), "def test_ok():\n    assert True\n");

            var result = step(List.of(
                    PatchInstruction.insert("app.py", "x = 1", null),
                    PatchInstruction.replace("tests/test_new.py", null, "def test_ok():\n    assert True\n"))).execute();

            assertTrue(result.success());
            assertEquals(ValidationReasons.PYTEST_NEW_FILE_PASSED, result.reasonCode());
            assertEquals(List.of("python3", "-m", "pytest", "tests/test_new.py"), runner.lastCommand());
        }

        @Test
        void withoutTestFilePatchFails() {
            var result = step(List.of(PatchInstruction.replace("app.py", null, "x = 1"))).execute();

            assertEquals(ValidationReasons.NO_NEW_TEST_FILE_PATCH, result.reasonCode());
            assertTrue(runner.commands().isEmpty());
        }

        @Test
        void missingFileFails() {
            var result = step(List.of(PatchInstruction.replace("tests/test_missing.py", null, "x"))).execute();

            assertEquals(ValidationReasons.TEST_FILE_NOT_FOUND, result.reasonCode());
        }

        @Test
        void failingTestFails() throws IOException {
            Files.writeString(base.resolve("test_bad.py"), "def test_bad():\n    assert False\n");
            runner.willReturn(1, "1 failed");

            var result = step(List.of(PatchInstruction.replace("test_bad.py", null, "x"))).execute();

            assertEquals(ValidationReasons.PYTEST_NEW_FILE_FAILED, result.reasonCode());
        }

        @Test
        void findNewTestFileIgnoresPartialReplaces() {
            assertTrue(PytestNewFileStep.findNewTestFile(
                    List.of(PatchInstruction.replace("tests/test_x.py", "old", "new"))).isEmpty());
        }
    }
}
