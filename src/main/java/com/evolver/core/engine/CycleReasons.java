package com.evolver.core.engine;

/**
 * Cycle-level reason codes.
 */
public final class CycleReasons {

    public static final String PLANNING_FAILED = "PLANNING_FAILED";
    public static final String MANIFEST_GENERATION_FAILED = "MANIFEST_GENERATION_FAILED";
    public static final String STRATEGY_SELECTION_FAILED = "STRATEGY_SELECTION_FAILED";
    public static final String CONFIG_ERROR = "CONFIG_ERROR";
    public static final String DEGENERATIVE_LOOP_DETECTED = "DEGENERATIVE_LOOP_DETECTED";
    public static final String UNEXPECTED_CYCLE_ERROR = "UNEXPECTED_CYCLE_ERROR";
    public static final String SANDBOX_SETUP_FAILED = "SANDBOX_SETUP_FAILED";
    public static final String COMMIT_FAILED_POST_SANITY = "COMMIT_FAILED_POST_SANITY";
    public static final String REGRESSION_PREFIX = "REGRESSION_DETECTED_BY_";

    private CycleReasons() {}
}
