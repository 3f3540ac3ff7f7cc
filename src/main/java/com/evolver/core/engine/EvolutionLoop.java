package com.evolver.core.engine;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.memory.EvolutionMemory;
import com.evolver.core.planning.ObjectiveGenerator;
import com.evolver.core.queue.ObjectiveQueue;
import com.evolver.core.scanner.ManifestGenerator;
import com.evolver.core.vcs.GitGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Drains the {@link ObjectiveQueue} one cycle at a time.
 *
 * <p>Without continuous mode the loop ends when the queue is empty. In continuous mode
 * it asks the {@link ObjectiveGenerator} for a fresh objective and waits before polling
 * again. {@link #stop()} takes effect between cycles; a running cycle always finishes,
 * but the idle waits wake up immediately.
 */
@Service
public class EvolutionLoop {

    private static final Logger log = LoggerFactory.getLogger(EvolutionLoop.class);

    private final CycleEngine engine;
    private final ObjectiveQueue queue;
    private final ObjectiveGenerator generator;
    private final ManifestGenerator manifestGenerator;
    private final EvolutionMemory memory;
    private final GitGateway git;
    private final EvolverProperties properties;

    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running;
    private ExecutorService executor;

    public EvolutionLoop(CycleEngine engine, ObjectiveQueue queue, ObjectiveGenerator generator,
                         ManifestGenerator manifestGenerator, EvolutionMemory memory, GitGateway git,
                         EvolverProperties properties) {
        this.engine = engine;
        this.queue = queue;
        this.generator = generator;
        this.manifestGenerator = manifestGenerator;
        this.memory = memory;
        this.git = git;
        this.properties = properties;
    }

    /**
     * Loads memory and makes sure the project is a git repository whose history will
     * not pick up engine state.
     */
    public void prepare() {
        memory.load();
        if (!git.isRepository()) {
            var init = git.initializeRepository();
            if (!init.success()) {
                log.warn("Could not initialize git repository: {}", init.output().strip());
            }
        } else {
            git.excludeStateDirectory();
        }
    }

    /**
     * Runs cycles on the calling thread until the queue is exhausted, the cycle cap is
     * reached, or {@link #stop()} is called.
     */
    public LoopSummary runToCompletion() {
        running = true;
        var outcomes = new ArrayList<CycleOutcome>();
        EvolverProperties.Loop settings = properties.getLoop();
        try {
            prepare();
            if (queue.isEmpty() && settings.isGenerateInitialObjective()) {
                generateObjective().ifPresent(queue::push);
            }

            while (!stopRequested()) {
                if (settings.getMaxCycles() > 0 && outcomes.size() >= settings.getMaxCycles()) {
                    log.info("Reached the cycle limit of {}", settings.getMaxCycles());
                    break;
                }
                Optional<String> next = queue.isEmpty() ? Optional.empty() : Optional.of(queue.pop());
                if (next.isEmpty()) {
                    if (!settings.isContinuous()) {
                        log.info("Objective queue is empty, stopping");
                        break;
                    }
                    generateObjective().ifPresent(queue::push);
                    if (awaitStop(settings.getContinuousDelay())) {
                        break;
                    }
                    continue;
                }

                outcomes.add(engine.runCycle(next.get()));
                if (awaitStop(settings.getCycleDelay())) {
                    break;
                }
            }
            return new LoopSummary(outcomes, stopRequested());
        } finally {
            running = false;
            stopSignal = new CountDownLatch(1);
        }
    }

    /**
     * Starts the loop on a dedicated single thread.
     *
     * @throws IllegalStateException if the loop is already running
     */
    public synchronized Future<LoopSummary> start() {
        if (running || (executor != null && !executor.isTerminated())) {
            throw new IllegalStateException("Evolution loop is already running");
        }
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "evolution-loop");
            t.setDaemon(false);
            return t;
        });
        Future<LoopSummary> future = executor.submit(this::runToCompletion);
        executor.shutdown();
        return future;
    }

    /** Requests a stop; the current cycle completes first. */
    public void stop() {
        log.info("Stop requested");
        stopSignal.countDown();
    }

    /**
     * Stops the loop and waits for the running cycle to finish.
     */
    public synchronized boolean stopAndWait(Duration timeout) throws InterruptedException {
        stop();
        return executor == null || executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running;
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    /** Waits for {@code delay} or a stop request; returns true when stopped. */
    private boolean awaitStop(Duration delay) {
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return stopRequested();
        }
        try {
            return stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private Optional<String> generateObjective() {
        try {
            String manifest = manifestGenerator.generate(properties.getProjectRoot());
            String objective = generator.nextObjective(manifest, memory.historySummary());
            if (objective == null || objective.isBlank()) {
                log.warn("Objective generator returned nothing");
                return Optional.empty();
            }
            log.info("Generated objective: {}", objective.lines().findFirst().orElse(objective));
            return Optional.of(objective.strip());
        } catch (IOException | RuntimeException e) {
            log.error("Objective generation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
