package com.evolver.core.memory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One row of the evolution log CSV.
 */
@JsonPropertyOrder({"cycle", "objective", "status", "elapsed_seconds", "quality_placeholder",
        "strategy", "start_ts", "end_ts", "reason_code", "context"})
public record EvolutionLogRow(
    @JsonProperty("cycle") long cycle,
    @JsonProperty("objective") String objective,
    @JsonProperty("status") String status,
    @JsonProperty("elapsed_seconds") String elapsedSeconds,
    @JsonProperty("quality_placeholder") String qualityPlaceholder,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("start_ts") String startTs,
    @JsonProperty("end_ts") String endTs,
    @JsonProperty("reason_code") String reasonCode,
    @JsonProperty("context") String context
) {}
