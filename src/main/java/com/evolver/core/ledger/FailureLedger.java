package com.evolver.core.ledger;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.memory.EvolutionMemory;
import com.evolver.core.model.FailureLogEntry;
import com.evolver.core.model.OutcomeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Detects degenerate retry loops: the same objective failing again and again with no
 * success in between. The backing log lives in {@link EvolutionMemory}.
 */
@Service
public class FailureLedger {

    private static final Logger log = LoggerFactory.getLogger(FailureLedger.class);

    private final EvolutionMemory memory;
    private final Clock clock;
    private final int threshold;

    @Autowired
    public FailureLedger(EvolutionMemory memory, Clock clock, EvolverProperties properties) {
        this(memory, clock, properties.getEngine().getDegenerateLoopThreshold());
    }

    public FailureLedger(EvolutionMemory memory, Clock clock, int threshold) {
        this.memory = memory;
        this.clock = clock;
        this.threshold = threshold;
    }

    /**
     * Counts consecutive failures of {@code objective}, newest first, stopping at the
     * first success or once {@code threshold} is reached. Entries for other objectives are skipped.
     */
    public static int consecutiveFailures(List<FailureLogEntry> newestFirst, String objective, int threshold) {
        int count = 0;
        for (FailureLogEntry entry : newestFirst) {
            if (!entry.objective().equals(objective)) {
                continue;
            }
            if (entry.status() == OutcomeStatus.SUCCESS) {
                break;
            }
            count++;
            if (count >= threshold) {
                break;
            }
        }
        return count;
    }

    public int consecutiveFailures(String objective) {
        return consecutiveFailures(memory.recentLogNewestFirst(), objective, threshold);
    }

    public boolean isDegenerate(String objective) {
        int failures = consecutiveFailures(objective);
        if (failures >= threshold) {
            log.warn("Objective failed {} consecutive times, threshold {} reached", failures, threshold);
            return true;
        }
        return false;
    }

    public void record(String objective, OutcomeStatus status, String reasonCode) {
        memory.appendLog(new FailureLogEntry(objective, status, reasonCode, clock.instant()));
    }

    public int threshold() {
        return threshold;
    }
}
