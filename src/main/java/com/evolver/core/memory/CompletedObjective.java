package com.evolver.core.memory;

import java.time.Instant;

public record CompletedObjective(String objective, String strategy, String details, Instant date) {}
