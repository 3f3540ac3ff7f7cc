package com.evolver.core.engine;

/**
 * Phases of one objective cycle.
 */
public enum CyclePhase {
    AWAIT_OBJECTIVE,
    PLANNING,
    STRATEGY_SELECTION,
    CAPACITATION_BRANCH,
    EXECUTE_STRATEGY,
    SANITY_CHECK,
    PROMOTE_COMMIT,
    ROLLBACK,
    RECORD_OUTCOME
}
