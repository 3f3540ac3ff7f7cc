package com.evolver.core.validation;

/**
 * Builds a {@link ValidationStep} for one pipeline run.
 */
@FunctionalInterface
public interface StepFactory {

    ValidationStep create(StepContext context);
}
