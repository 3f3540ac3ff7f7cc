package com.evolver.core.validation.steps;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.process.CommandResult;
import com.evolver.core.process.ProcessRunner;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationStep;

import java.time.Duration;
import java.util.List;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Runs the project's test suite with pytest in the base path.
 */
public class PytestValidationStep implements ValidationStep {

    private final StepContext context;
    private final ProcessRunner processRunner;
    private final String pythonExecutable;
    private final String testDir;
    private final Duration timeout;

    public PytestValidationStep(StepContext context, ProcessRunner processRunner,
                                String pythonExecutable, String testDir, Duration timeout) {
        this.context = context;
        this.processRunner = processRunner;
        this.pythonExecutable = pythonExecutable;
        this.testDir = testDir;
        this.timeout = timeout;
    }

    @Override
    public StepKind kind() {
        return StepKind.RUN_PYTEST_VALIDATION;
    }

    @Override
    public ValidationResult execute() {
        CommandResult result = processRunner.run(
                List.of(pythonExecutable, "-m", "pytest", testDir), context.basePath(), timeout);
        if (result.succeeded()) {
            return ValidationResult.success(PYTEST_SUCCESS, "Pytest execution succeeded.");
        }
        return ValidationResult.failure(context.qualify(PYTEST_FAILURE), result.output());
    }
}
