package com.evolver.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Immutable entry of the recent-objectives log used for degenerate-loop detection.
 */
public record FailureLogEntry(
    String objective,
    OutcomeStatus status,
    String reasonCode,
    Instant timestamp
) implements Serializable {}
