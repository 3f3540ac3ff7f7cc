package com.evolver.core.validation;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running a strategy's steps.
 *
 * @param result        final result (first failure, or the success default)
 * @param diskModified  true when the run succeeded and left changes that need promotion
 * @param fileStatuses  per-file apply status collected from the steps
 * @param executedSteps steps that actually ran, in order
 */
public record PipelineResult(
    ValidationResult result,
    boolean diskModified,
    Map<String, String> fileStatuses,
    List<StepKind> executedSteps
) {

    public PipelineResult {
        fileStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(fileStatuses));
        executedSteps = List.copyOf(executedSteps);
    }

    public boolean success() {
        return result.success();
    }
}
