package com.evolver.core.planning;

import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.StrategyDecision;

/**
 * Chooses the validation strategy for a plan, or reports a capability gap.
 */
public interface StrategySelector {

    /**
     * @param failureContext details of the previous failure of this objective, or null
     * @throws StrategySelectionException when no decision can be made
     */
    StrategyDecision select(ActionPlan plan, String failureContext);
}
