package com.evolver.core.memory;

import com.evolver.core.model.FailureLogEntry;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * On-disk shape of the memory file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MemorySnapshot(
    List<CompletedObjective> completedObjectives,
    List<FailedObjective> failedObjectives,
    List<String> acquiredCapabilities,
    List<FailureLogEntry> recentObjectivesLog
) {

    public static MemorySnapshot empty() {
        return new MemorySnapshot(List.of(), List.of(), List.of(), List.of());
    }
}
