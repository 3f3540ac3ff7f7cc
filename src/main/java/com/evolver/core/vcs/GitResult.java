package com.evolver.core.vcs;

/**
 * Outcome of one git invocation. Output is stdout and stderr, captured verbatim.
 */
public record GitResult(boolean success, String output) {}
