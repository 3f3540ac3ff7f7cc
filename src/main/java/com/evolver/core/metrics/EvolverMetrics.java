package com.evolver.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Evolver cycle execution.
 */
@Service
public class EvolverMetrics {

    private final MeterRegistry registry;

    public EvolverMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCycleResult(boolean success, String reasonCode) {
        Counter.builder("evolver.cycles.total")
                .tag("status", success ? "success" : "failure")
                .tag("reason", reasonCode)
                .register(registry)
                .increment();
    }

    public void recordCycleDuration(long ms) {
        Timer.builder("evolver.cycle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPlanningDuration(long ms) {
        Timer.builder("evolver.planning.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepCount(String strategy, int executedSteps) {
        DistributionSummary.builder("evolver.strategy.executed_steps")
                .tag("strategy", strategy)
                .register(registry)
                .record(executedSteps);
    }

    public void recordPromotion(boolean success) {
        Counter.builder("evolver.promotions.total")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
    }

    /**
     * Records a rollback of the real tree.
     *
     * @param trigger reason code that caused it, e.g. a regression or a failed commit
     */
    public void recordRollback(String trigger) {
        Counter.builder("evolver.rollbacks.total")
                .description("Working tree rollbacks after promotion")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void recordDegenerateLoop() {
        Counter.builder("evolver.degenerate_loops.total")
                .description("Objectives discarded after repeated consecutive failures")
                .register(registry)
                .increment();
    }

    public void recordObjectivePushed(String kind) {
        Counter.builder("evolver.objectives.pushed")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
