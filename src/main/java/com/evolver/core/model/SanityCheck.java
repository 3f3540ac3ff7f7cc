package com.evolver.core.model;

import java.io.Serializable;
import java.util.Optional;

/**
 * The post-promotion check of a strategy. {@link #none()} is an explicit value meaning
 * "keep promoted changes without re-checking the real tree".
 */
public record SanityCheck(StepKind step) implements Serializable {

    private static final SanityCheck NONE = new SanityCheck(null);

    public static SanityCheck none() {
        return NONE;
    }

    public static SanityCheck of(StepKind step) {
        if (step == null) {
            throw new IllegalArgumentException("Use SanityCheck.none() for a strategy without sanity check");
        }
        return new SanityCheck(step);
    }

    public boolean isNone() {
        return step == null;
    }

    public Optional<StepKind> stepKind() {
        return Optional.ofNullable(step);
    }

    public String displayName() {
        return step == null ? "skip_sanity_check" : step.wireName();
    }
}
