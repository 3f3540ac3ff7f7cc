package com.evolver.core.planning;

import com.evolver.core.model.ActionPlan;

/**
 * Produces a change plan for an objective.
 */
public interface Planner {

    /**
     * @param objective   the objective text, possibly a correction or capacitation task
     * @param manifest    rendered project manifest
     * @param fileContext contents of files the objective mentions, may be empty
     * @return the plan; a {@code null} result or patch list is treated as a planning failure
     * @throws PlanningException when no plan can be produced
     */
    ActionPlan plan(String objective, String manifest, String fileContext);
}
