package com.evolver.core.llm;

import com.evolver.core.planning.ObjectiveGenerator;
import com.evolver.core.planning.Planner;
import com.evolver.core.planning.StrategySelector;
import com.evolver.core.validation.StrategyCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Default LLM-backed collaborators. Disable with {@code evolver.llm.enabled=false} and
 * provide your own {@link Planner}, {@link StrategySelector} and {@link ObjectiveGenerator} beans.
 */
@Configuration
@ConditionalOnProperty(name = "evolver.llm.enabled", havingValue = "true", matchIfMissing = true)
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public LlmService llmService(ChatClient.Builder builder,
                                 @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
        return new LlmService(builder.build());
    }

    @Bean
    @ConditionalOnMissingBean(Planner.class)
    public Planner llmPlanner(LlmService llmService) {
        return new LlmPlanner(llmService);
    }

    @Bean
    @ConditionalOnMissingBean(StrategySelector.class)
    public StrategySelector llmStrategySelector(LlmService llmService, StrategyCatalog catalog, ObjectMapper mapper) {
        return new LlmStrategySelector(llmService, catalog, mapper);
    }

    @Bean
    @ConditionalOnMissingBean(ObjectiveGenerator.class)
    public ObjectiveGenerator llmObjectiveGenerator(LlmService llmService) {
        return new LlmObjectiveGenerator(llmService);
    }
}
