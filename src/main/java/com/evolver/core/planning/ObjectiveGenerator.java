package com.evolver.core.planning;

/**
 * Synthesizes new objectives and commit messages.
 */
public interface ObjectiveGenerator {

    /** Next evolutionary objective after a successful cycle or on an empty queue. */
    String nextObjective(String manifest, String memorySummary);

    /** Objective that closes a capability gap the strategy selector reported. */
    String capacitationObjective(String analysis, String memorySummary);

    String commitMessage(String analysis, String objective);
}
