package com.evolver.core.validation;

/**
 * Thrown when a strategy key or one of its step names cannot be resolved.
 */
public class StrategyResolutionException extends RuntimeException {

    private final String reasonCode;

    public StrategyResolutionException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
