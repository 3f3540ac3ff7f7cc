package com.evolver.core.patch;

/**
 * Reason codes produced while applying patch instructions.
 */
public final class PatchReasons {

    public static final String PATCH_APPLIED = "PATCH_APPLIED";
    public static final String BLOCK_NOT_FOUND = "BLOCK_NOT_FOUND";
    public static final String INVALID_PATCH_PATH = "INVALID_PATCH_PATH";
    public static final String INVALID_PATCH_INSTRUCTION = "INVALID_PATCH_INSTRUCTION";
    public static final String INVALID_MATCH_PATTERN = "INVALID_MATCH_PATTERN";
    public static final String PATCH_IO_ERROR = "PATCH_IO_ERROR";

    private PatchReasons() {}
}
