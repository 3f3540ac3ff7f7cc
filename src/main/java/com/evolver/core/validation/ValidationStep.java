package com.evolver.core.validation;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;

import java.util.Map;

/**
 * A single named check or mutation in a validation strategy.
 */
public interface ValidationStep {

    StepKind kind();

    ValidationResult execute();

    /** Per-file apply status, for steps that write files. */
    default Map<String, String> fileStatuses() {
        return Map.of();
    }
}
