package com.evolver.core.engine;

import com.evolver.core.model.ValidationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * What one cycle produced.
 *
 * @param pushedObjectives objectives pushed onto the queue, in push order
 */
public record CycleOutcome(
    long cycle,
    String objective,
    ValidationResult result,
    String strategyKey,
    Instant start,
    Instant end,
    List<String> pushedObjectives
) {

    public CycleOutcome {
        pushedObjectives = List.copyOf(pushedObjectives);
    }

    public boolean success() {
        return result.success();
    }

    public String reasonCode() {
        return result.reasonCode();
    }

    public Duration elapsed() {
        return Duration.between(start, end);
    }
}
