package com.evolver.core.validation.steps;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationStep;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Set;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Verifies that every file the plan touches exists, except files it deletes outright.
 */
public class FileExistenceStep implements ValidationStep {

    private final StepContext context;

    public FileExistenceStep(StepContext context) {
        this.context = context;
    }

    @Override
    public StepKind kind() {
        return StepKind.CHECK_FILE_EXISTENCE;
    }

    @Override
    public ValidationResult execute() {
        Set<String> expected = PatchedFiles.expectedToExist(context.patches());
        var missing = new ArrayList<String>();
        for (String file : expected) {
            if (!Files.exists(context.basePath().resolve(file))) {
                missing.add(file);
            }
        }
        if (!missing.isEmpty()) {
            return ValidationResult.failure(FILE_EXISTENCE_CHECK_FAILED, "Missing files: " + String.join(", ", missing));
        }
        return ValidationResult.success(FILE_EXISTENCE_CHECK_PASSED, "All %d file(s) present".formatted(expected.size()));
    }
}
