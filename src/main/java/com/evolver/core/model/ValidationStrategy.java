package com.evolver.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An ordered list of validation steps plus the sanity check to run after promotion.
 * Immutable once selected for a cycle.
 */
public record ValidationStrategy(
    String key,
    List<StepKind> steps,
    SanityCheck sanityCheck
) implements Serializable {

    public ValidationStrategy {
        steps = List.copyOf(steps);
        sanityCheck = sanityCheck != null ? sanityCheck : SanityCheck.none();
    }

    /** True when at least one step writes to disk. */
    public boolean modifiesDisk() {
        return steps.stream().anyMatch(StepKind::modifiesDisk);
    }

    /** True when the strategy has any step at all; every known step reads or writes project files. */
    public boolean touchesFiles() {
        return !steps.isEmpty();
    }
}
