package com.evolver.sandbox;

import com.evolver.core.model.ValidationResult;

import java.util.List;

/**
 * Outcome of promoting a sandbox into the real tree.
 *
 * @param result             {@code APPLIED_AND_VALIDATED_SANDBOX} or {@code PROMOTION_FAILED}
 * @param createdPaths       real-tree files that did not exist before promotion
 * @param createdDirectories real-tree directories promotion had to create, deepest first
 */
public record PromotionReport(ValidationResult result, List<String> createdPaths, List<String> createdDirectories) {

    public PromotionReport {
        createdPaths = List.copyOf(createdPaths);
        createdDirectories = List.copyOf(createdDirectories);
    }

    public boolean success() {
        return result.success();
    }
}
