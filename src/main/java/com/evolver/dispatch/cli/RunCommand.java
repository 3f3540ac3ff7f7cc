package com.evolver.dispatch.cli;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.engine.CycleOutcome;
import com.evolver.core.engine.EvolutionLoop;
import com.evolver.core.engine.LoopSummary;
import com.evolver.core.queue.ObjectiveQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: evolver run ["&lt;objective&gt;"]
 * <p>
 * Pushes the optional objective and drains the queue through the evolution loop,
 * printing one line per cycle.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run evolution cycles")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Parameters(index = "0", arity = "0..1", description = "Initial objective (generated when omitted)")
    private String objective;

    @Option(names = {"--continuous", "-c"}, description = "Keep generating objectives when the queue is empty")
    private boolean continuous;

    @Option(names = {"--max-cycles", "-n"}, description = "Stop after this many cycles (0 = unlimited)",
            defaultValue = "-1")
    private int maxCycles;

    @Option(names = "--no-follow-ups", description = "Do not queue a follow-up objective after a success")
    private boolean noFollowUps;

    private final EvolutionLoop loop;
    private final ObjectiveQueue queue;
    private final EvolverProperties properties;

    public RunCommand(EvolutionLoop loop, ObjectiveQueue queue, EvolverProperties properties) {
        this.loop = loop;
        this.queue = queue;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        applyOverrides();
        ConsoleOutput.info("Project: " + properties.getProjectRoot());

        if (objective != null && !objective.isBlank()) {
            queue.push(objective);
        }

        Thread shutdownHook = new Thread(loop::stop, "evolver-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LoopSummary summary;
        try {
            summary = loop.runToCompletion();
        } catch (RuntimeException e) {
            ConsoleOutput.error("Evolution loop failed: " + e.getMessage());
            return 1;
        } finally {
            removeHook(shutdownHook);
        }

        for (CycleOutcome outcome : summary.outcomes()) {
            ConsoleOutput.cycle(outcome);
        }
        ConsoleOutput.summary(summary);
        return summary.cycles() > 0 && summary.failures() == summary.cycles() ? 2 : 0;
    }

    private void applyOverrides() {
        EvolverProperties.Loop settings = properties.getLoop();
        if (continuous) {
            settings.setContinuous(true);
        }
        if (maxCycles >= 0) {
            settings.setMaxCycles(maxCycles);
        }
        if (noFollowUps) {
            properties.getEngine().setGenerateFollowUps(false);
        }
        if (objective != null && !objective.isBlank()) {
            settings.setGenerateInitialObjective(false);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("Shutdown hook left in place, JVM is already shutting down: {}", e.getMessage());
        }
    }
}
