package com.evolver.core.validation;

import com.evolver.core.model.PatchInstruction;

import java.nio.file.Path;
import java.util.List;

/**
 * Inputs a validation step is built with.
 *
 * @param basePath         directory the step reads and writes (sandbox or real project root)
 * @param patches          the plan's instructions, in order
 * @param runningInSandbox true when {@code basePath} is a sandbox copy
 */
public record StepContext(Path basePath, List<PatchInstruction> patches, boolean runningInSandbox) {

    public StepContext {
        patches = patches != null ? List.copyOf(patches) : List.of();
    }

    /** Appends {@code _IN_SANDBOX} to a failure code when running in the sandbox. */
    public String qualify(String reasonCode) {
        return runningInSandbox ? reasonCode + "_IN_SANDBOX" : reasonCode;
    }
}
