package com.evolver.core.validation.steps;

import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.PatchOperation;
import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.process.CommandResult;
import com.evolver.core.process.ProcessRunner;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Runs pytest against a test file the plan creates with a whole-file REPLACE.
 */
public class PytestNewFileStep implements ValidationStep {

    private static final Logger log = LoggerFactory.getLogger(PytestNewFileStep.class);

    private final StepContext context;
    private final ProcessRunner processRunner;
    private final String pythonExecutable;
    private final Duration timeout;

    public PytestNewFileStep(StepContext context, ProcessRunner processRunner,
                             String pythonExecutable, Duration timeout) {
        this.context = context;
        this.processRunner = processRunner;
        this.pythonExecutable = pythonExecutable;
        this.timeout = timeout;
    }

    @Override
    public StepKind kind() {
        return StepKind.RUN_PYTEST_NEW_FILE;
    }

    @Override
    public ValidationResult execute() {
        Optional<String> testFile = findNewTestFile(context.patches());
        if (testFile.isEmpty()) {
            return ValidationResult.failure(NO_NEW_TEST_FILE_PATCH, "No patch found for creating a new test file.");
        }

        String file = testFile.get();
        if (!Files.isRegularFile(context.basePath().resolve(file))) {
            return ValidationResult.failure(TEST_FILE_NOT_FOUND,
                    "Test file %s not found in %s.".formatted(file, context.basePath()));
        }

        log.info("Running pytest on new test file {}", file);
        CommandResult result = processRunner.run(
                List.of(pythonExecutable, "-m", "pytest", file), context.basePath(), timeout);
        if (!result.succeeded()) {
            return ValidationResult.failure(PYTEST_NEW_FILE_FAILED, result.output());
        }
        return ValidationResult.success(PYTEST_NEW_FILE_PASSED, "Pytest passed for %s.\n%s".formatted(file, result.output()));
    }

    static Optional<String> findNewTestFile(List<PatchInstruction> patches) {
        return patches.stream()
                .filter(p -> p.operation() == PatchOperation.REPLACE && p.targetsWholeFile())
                .map(PatchInstruction::filePath)
                .filter(path -> path != null && (path.startsWith("tests/") || path.contains("test")))
                .findFirst();
    }
}
