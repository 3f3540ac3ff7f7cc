package com.evolver.core.llm;

import com.fasterxml.jackson.annotation.JsonAlias;

/**
 * Structured answer of the strategy-selection prompt.
 */
public record StrategyChoice(
    @JsonAlias("strategy_key") String strategyKey,
    String rationale
) {}
