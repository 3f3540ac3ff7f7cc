package com.evolver.core.model;

/**
 * What the strategy selector decided for a plan: a strategy key, or a capability gap.
 */
public record StrategyDecision(String strategyKey, boolean capacitationRequired) {

    public static final String CAPACITATION_REQUIRED = "CAPACITATION_REQUIRED";

    public static StrategyDecision strategy(String key) {
        return new StrategyDecision(key, false);
    }

    public static StrategyDecision capacitation() {
        return new StrategyDecision(CAPACITATION_REQUIRED, true);
    }
}
