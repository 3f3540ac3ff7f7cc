package com.evolver.core.model;

/**
 * Final status of one objective attempt, as recorded in the failure ledger.
 */
public enum OutcomeStatus {
    SUCCESS,
    FAILURE
}
