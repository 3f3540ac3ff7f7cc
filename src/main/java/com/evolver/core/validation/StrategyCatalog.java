package com.evolver.core.validation;

import com.evolver.core.model.SanityCheck;
import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Resolves strategy keys from configuration into {@link ValidationStrategy} values.
 * Step names are checked here, so an unknown step is rejected before anything runs.
 */
@Service
public class StrategyCatalog {

    private static final Logger log = LoggerFactory.getLogger(StrategyCatalog.class);

    private static final Set<String> NO_SANITY_CHECK = Set.of("skip_sanity_check", "none", "");

    private final StrategyProperties properties;
    private final ValidationStepRegistry registry;

    public StrategyCatalog(StrategyProperties properties, ValidationStepRegistry registry) {
        this.properties = properties;
        this.registry = registry;
        log.info("Loaded {} validation strategies: {}", properties.getStrategies().size(), keys());
    }

    public boolean contains(String key) {
        return key != null && properties.getStrategies().containsKey(key);
    }

    public Set<String> keys() {
        return new TreeSet<>(properties.getStrategies().keySet());
    }

    public ValidationStrategy resolve(String key) {
        StrategyProperties.Definition definition = key == null ? null : properties.getStrategies().get(key);
        if (definition == null) {
            throw new StrategyResolutionException(UNKNOWN_STRATEGY, "Unknown strategy: " + key);
        }

        var steps = new ArrayList<StepKind>();
        for (String name : definition.getSteps()) {
            StepKind kind = StepKind.fromName(name)
                    .filter(registry::supports)
                    .orElseThrow(() -> new StrategyResolutionException(UNKNOWN_VALIDATION_STEP,
                            "Strategy %s names unknown validation step '%s'".formatted(key, name)));
            steps.add(kind);
        }

        return new ValidationStrategy(key, steps, resolveSanityCheck(key, definition.getSanityCheckStep()));
    }

    private SanityCheck resolveSanityCheck(String key, String name) {
        if (name == null || NO_SANITY_CHECK.contains(name.trim().toLowerCase(Locale.ROOT))) {
            return SanityCheck.none();
        }
        StepKind kind = StepKind.fromName(name)
                .filter(registry::supports)
                .orElseThrow(() -> new StrategyResolutionException(UNKNOWN_VALIDATION_STEP,
                        "Strategy %s names unknown sanity check step '%s'".formatted(key, name)));
        if (kind.modifiesDisk()) {
            throw new StrategyResolutionException(INVALID_SANITY_CHECK_STEP,
                    "Strategy %s uses %s as sanity check, which writes to disk".formatted(key, name));
        }
        return SanityCheck.of(kind);
    }
}
