package com.evolver.core.validation;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw strategy table as configured under {@code evolver.strategies}.
 * Keys contain underscores, so YAML must use bracket notation ({@code "[SYNTAX_ONLY]"}).
 */
@Component
@ConfigurationProperties(prefix = "evolver")
public class StrategyProperties {

    private Map<String, Definition> strategies = new LinkedHashMap<>();

    public Map<String, Definition> getStrategies() { return strategies; }
    public void setStrategies(Map<String, Definition> strategies) { this.strategies = strategies; }

    public static class Definition {
        private List<String> steps = new ArrayList<>();
        private String sanityCheckStep = "skip_sanity_check";

        public Definition() {}

        public Definition(List<String> steps, String sanityCheckStep) {
            this.steps = new ArrayList<>(steps);
            this.sanityCheckStep = sanityCheckStep;
        }

        public List<String> getSteps() { return steps; }
        public void setSteps(List<String> steps) { this.steps = steps; }
        public String getSanityCheckStep() { return sanityCheckStep; }
        public void setSanityCheckStep(String sanityCheckStep) { this.sanityCheckStep = sanityCheckStep; }
    }
}
