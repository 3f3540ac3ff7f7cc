package com.evolver.core.ledger;

import com.evolver.core.config.JsonMappers;
import com.evolver.core.memory.EvolutionMemory;
import com.evolver.core.model.FailureLogEntry;
import com.evolver.core.model.OutcomeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FailureLedgerTest {

    private static final Instant T = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private FailureLedger ledger;

    @BeforeEach
    void setUp() {
        var memory = new EvolutionMemory(dir.resolve("memory.json"), JsonMappers.create(), Clock.systemUTC(), 20, 20);
        ledger = new FailureLedger(memory, Clock.systemUTC(), 3);
    }

    private static FailureLogEntry entry(String objective, OutcomeStatus status) {
        return new FailureLogEntry(objective, status, status.name(), T);
    }

    // --- pure counting ---

    @Test
    void countsUntilFirstSuccess() {
        var log = List.of(
                entry("o", OutcomeStatus.FAILURE),
                entry("o", OutcomeStatus.FAILURE),
                entry("o", OutcomeStatus.SUCCESS),
                entry("o", OutcomeStatus.FAILURE));

        assertEquals(2, FailureLedger.consecutiveFailures(log, "o", 5));
    }

    @Test
    void skipsOtherObjectives() {
        var log = List.of(
                entry("o", OutcomeStatus.FAILURE),
                entry("other", OutcomeStatus.SUCCESS),
                entry("o", OutcomeStatus.FAILURE));

        assertEquals(2, FailureLedger.consecutiveFailures(log, "o", 5));
    }

    @Test
    void stopsCountingAtThreshold() {
        var log = List.of(
                entry("o", OutcomeStatus.FAILURE),
                entry("o", OutcomeStatus.FAILURE),
                entry("o", OutcomeStatus.FAILURE),
                entry("o", OutcomeStatus.FAILURE));

        assertEquals(3, FailureLedger.consecutiveFailures(log, "o", 3));
    }

    @Test
    void emptyLogHasNoFailures() {
        assertEquals(0, FailureLedger.consecutiveFailures(List.of(), "o", 3));
    }

    // --- recorded outcomes ---

    @Test
    void objectiveBecomesDegenerateAfterThresholdFailures() {
        ledger.record("fix it", OutcomeStatus.FAILURE, "PYTEST_FAILURE");
        ledger.record("fix it", OutcomeStatus.FAILURE, "PYTEST_FAILURE");
        assertFalse(ledger.isDegenerate("fix it"));

        ledger.record("fix it", OutcomeStatus.FAILURE, "PYTEST_FAILURE");

        assertTrue(ledger.isDegenerate("fix it"));
        assertFalse(ledger.isDegenerate("something else"));
    }

    @Test
    void interveningSuccessResetsTheCount() {
        ledger.record("o", OutcomeStatus.FAILURE, "X");
        ledger.record("o", OutcomeStatus.FAILURE, "X");
        ledger.record("o", OutcomeStatus.SUCCESS, "STRATEGY_SUCCEEDED");
        ledger.record("o", OutcomeStatus.FAILURE, "X");

        assertEquals(1, ledger.consecutiveFailures("o"));
        assertFalse(ledger.isDegenerate("o"));
    }
}
