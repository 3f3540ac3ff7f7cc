package com.evolver.core.planning;

/**
 * Thrown when a strategy selector cannot reach a decision.
 */
public class StrategySelectionException extends RuntimeException {

    public StrategySelectionException(String message) {
        super(message);
    }

    public StrategySelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
