package com.evolver.core.model;

import java.io.Serializable;

/**
 * Outcome of a validation step, of a whole strategy pipeline, or of a full cycle.
 *
 * @param success    whether the unit of work succeeded
 * @param reasonCode machine-readable reason, e.g. {@code BLOCK_NOT_FOUND}
 * @param details    human-readable diagnostics (tool output, file names)
 */
public record ValidationResult(
    boolean success,
    String reasonCode,
    String details
) implements Serializable {

    public static final String PENDING = "PENDING";

    public static ValidationResult success(String reasonCode, String details) {
        return new ValidationResult(true, reasonCode, details);
    }

    public static ValidationResult failure(String reasonCode, String details) {
        return new ValidationResult(false, reasonCode, details);
    }

    public static ValidationResult pending(String details) {
        return new ValidationResult(false, PENDING, details);
    }

    public boolean isPending() {
        return PENDING.equals(reasonCode);
    }
}
