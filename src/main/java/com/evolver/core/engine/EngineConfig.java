package com.evolver.core.engine;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.ledger.FailureLedger;
import com.evolver.core.memory.EvolutionLog;
import com.evolver.core.memory.EvolutionMemory;
import com.evolver.core.metrics.EvolverMetrics;
import com.evolver.core.planning.ObjectiveGenerator;
import com.evolver.core.planning.Planner;
import com.evolver.core.planning.StrategySelector;
import com.evolver.core.queue.ObjectiveQueue;
import com.evolver.core.scanner.ManifestGenerator;
import com.evolver.core.validation.StrategyCatalog;
import com.evolver.core.validation.ValidationPipeline;
import com.evolver.core.vcs.GitGateway;
import com.evolver.sandbox.PromotionManager;
import com.evolver.sandbox.SandboxManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    @Bean
    public EngineContext engineContext(EvolverProperties properties,
                                       Planner planner,
                                       StrategySelector strategySelector,
                                       ObjectiveGenerator objectiveGenerator,
                                       ManifestGenerator manifestGenerator,
                                       StrategyCatalog strategyCatalog,
                                       ValidationPipeline pipeline,
                                       SandboxManager sandboxManager,
                                       PromotionManager promotionManager,
                                       GitGateway git,
                                       FailureLedger ledger,
                                       EvolutionMemory memory,
                                       EvolutionLog evolutionLog,
                                       ObjectiveQueue queue,
                                       EvolverMetrics metrics,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        return new EngineContext(properties, planner, strategySelector, objectiveGenerator, manifestGenerator,
                strategyCatalog, pipeline, sandboxManager, promotionManager, git, ledger, memory, evolutionLog,
                queue, metrics, objectMapper, clock);
    }
}
