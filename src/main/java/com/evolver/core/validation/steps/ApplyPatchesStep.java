package com.evolver.core.validation.steps;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.patch.ApplyReport;
import com.evolver.core.patch.PatchApplicator;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationReasons;
import com.evolver.core.validation.ValidationStep;

import java.util.Map;

/**
 * Writes the plan's instructions to the base path.
 */
public class ApplyPatchesStep implements ValidationStep {

    private final StepContext context;
    private final PatchApplicator applicator;
    private Map<String, String> fileStatuses = Map.of();

    public ApplyPatchesStep(StepContext context, PatchApplicator applicator) {
        this.context = context;
        this.applicator = applicator;
    }

    @Override
    public StepKind kind() {
        return StepKind.APPLY_PATCHES_TO_DISK;
    }

    @Override
    public ValidationResult execute() {
        if (context.patches().isEmpty()) {
            return ValidationResult.success(ValidationReasons.NO_CHANGES_TO_PROMOTE, "Plan contains no patches");
        }
        ApplyReport report = applicator.applyAll(context.basePath(), context.patches());
        fileStatuses = report.fileStatuses();
        return report.result();
    }

    @Override
    public Map<String, String> fileStatuses() {
        return fileStatuses;
    }
}
