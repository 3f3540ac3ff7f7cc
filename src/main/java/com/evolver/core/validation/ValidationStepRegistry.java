package com.evolver.core.validation;

import com.evolver.core.model.StepKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps every {@link StepKind} to the factory that builds it.
 * The production table is assembled in {@code ValidationConfig}.
 */
public class ValidationStepRegistry {

    private final Map<StepKind, StepFactory> factories;

    public ValidationStepRegistry(Map<StepKind, StepFactory> factories) {
        this.factories = factories.isEmpty() ? new EnumMap<>(StepKind.class) : new EnumMap<>(factories);
    }

    public boolean supports(StepKind kind) {
        return factories.containsKey(kind);
    }

    public Optional<ValidationStep> create(StepKind kind, StepContext context) {
        StepFactory factory = factories.get(kind);
        return factory == null ? Optional.empty() : Optional.of(factory.create(context));
    }
}
