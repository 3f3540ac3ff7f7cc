package com.evolver.core.llm;

import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.StrategyDecision;
import com.evolver.core.planning.StrategySelectionException;
import com.evolver.core.planning.StrategySelector;
import com.evolver.core.validation.StrategyCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lets the LLM pick one of the configured strategy keys, or report a capability gap
 * with {@code CAPACITATION_REQUIRED}.
 */
public class LlmStrategySelector implements StrategySelector {

    private static final Logger log = LoggerFactory.getLogger(LlmStrategySelector.class);

    static final String SYSTEM_PROMPT = """
            You choose how a proposed code change is validated before it is kept.
            Pick exactly one strategy key from the list you are given.
            If the plan cannot work because the agent lacks a capability (a missing tool,
            library or module), answer with the key CAPACITATION_REQUIRED instead.
            """;

    private final LlmService llmService;
    private final StrategyCatalog catalog;
    private final ObjectMapper mapper;

    public LlmStrategySelector(LlmService llmService, StrategyCatalog catalog, ObjectMapper mapper) {
        this.llmService = llmService;
        this.catalog = catalog;
        this.mapper = mapper;
    }

    @Override
    public StrategyDecision select(ActionPlan plan, String failureContext) {
        String userPrompt = """
                Available strategies: %s

                Plan analysis:
                %s

                Patches:
                %s

                Previous failure of this objective:
                %s
                """.formatted(catalog.keys(), plan.analysis(), patchesJson(plan),
                failureContext == null ? "(none)" : failureContext);

        StrategyChoice choice;
        try {
            choice = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, StrategyChoice.class);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new StrategySelectionException("LLM strategy selection failed: " + e.getMessage(), e);
        }
        if (choice == null || choice.strategyKey() == null || choice.strategyKey().isBlank()) {
            throw new StrategySelectionException("LLM returned no strategy key");
        }

        String key = choice.strategyKey().strip();
        log.info("Selected strategy {}: {}", key, choice.rationale());
        if (StrategyDecision.CAPACITATION_REQUIRED.equals(key)) {
            return StrategyDecision.capacitation();
        }
        return StrategyDecision.strategy(key);
    }

    private String patchesJson(ActionPlan plan) {
        try {
            return mapper.writeValueAsString(plan.patches());
        } catch (JsonProcessingException e) {
            throw new StrategySelectionException("Cannot serialize plan patches", e);
        }
    }
}
