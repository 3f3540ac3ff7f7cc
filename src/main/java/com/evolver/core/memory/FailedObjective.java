package com.evolver.core.memory;

import java.time.Instant;

public record FailedObjective(String objective, String reason, String details, Instant date) {}
