package com.evolver.core.engine;

import java.util.List;

/**
 * Cycles run by one {@link EvolutionLoop} session.
 */
public record LoopSummary(List<CycleOutcome> outcomes, boolean stoppedByRequest) {

    public LoopSummary {
        outcomes = List.copyOf(outcomes);
    }

    public int cycles() {
        return outcomes.size();
    }

    public long successes() {
        return outcomes.stream().filter(CycleOutcome::success).count();
    }

    public long failures() {
        return cycles() - successes();
    }
}
