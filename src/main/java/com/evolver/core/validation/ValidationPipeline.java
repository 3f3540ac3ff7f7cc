package com.evolver.core.validation;

import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.model.ValidationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Runs a strategy's steps strictly in order and stops at the first failure.
 */
@Service
public class ValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(ValidationPipeline.class);

    private final ValidationStepRegistry registry;

    public ValidationPipeline(ValidationStepRegistry registry) {
        this.registry = registry;
    }

    public PipelineResult run(ValidationStrategy strategy, Path basePath,
                              List<PatchInstruction> patches, boolean inSandbox) {
        var executed = new ArrayList<StepKind>();
        var statuses = new LinkedHashMap<String, String>();

        if (strategy.steps().isEmpty()) {
            log.info("Strategy {} has no steps, objective discarded", strategy.key());
            return new PipelineResult(
                    ValidationResult.success(DISCARDED, "Strategy " + strategy.key() + " has no validation steps"),
                    false, statuses, executed);
        }

        var context = new StepContext(basePath, patches, inSandbox);
        boolean nothingToPromote = false;

        for (StepKind kind : strategy.steps()) {
            Optional<ValidationStep> step = registry.create(kind, context);
            if (step.isEmpty()) {
                log.error("No factory registered for step {}", kind.wireName());
                return new PipelineResult(
                        ValidationResult.failure(UNKNOWN_VALIDATION_STEP, "Unknown validation step: " + kind.wireName()),
                        false, statuses, executed);
            }

            log.info("Running step {} ({})", kind.wireName(), inSandbox ? "sandbox" : "project root");
            executed.add(kind);
            ValidationResult result = runGuarded(step.get());
            statuses.putAll(step.get().fileStatuses());

            if (!result.success()) {
                log.warn("Step {} failed: {} {}", kind.wireName(), result.reasonCode(), abbreviate(result.details()));
                return new PipelineResult(result, false, statuses, executed);
            }
            if (NO_CHANGES_TO_PROMOTE.equals(result.reasonCode())) {
                nothingToPromote = true;
            }
        }

        boolean diskModified = strategy.modifiesDisk() && !patches.isEmpty() && !nothingToPromote;
        ValidationResult success = diskModified
                ? ValidationResult.success(STRATEGY_SUCCEEDED, "All %d step(s) of %s passed".formatted(executed.size(), strategy.key()))
                : ValidationResult.success(VALIDATION_SUCCESS_NO_CHANGES, "Strategy " + strategy.key() + " passed without changes to promote");
        return new PipelineResult(success, diskModified, statuses, executed);
    }

    /**
     * Runs a single step, used for the post-promotion sanity check on the real tree.
     */
    public ValidationResult runSingle(StepKind kind, Path basePath, List<PatchInstruction> patches, boolean inSandbox) {
        Optional<ValidationStep> step = registry.create(kind, new StepContext(basePath, patches, inSandbox));
        if (step.isEmpty()) {
            return ValidationResult.failure(UNKNOWN_VALIDATION_STEP, "Unknown validation step: " + kind.wireName());
        }
        return runGuarded(step.get());
    }

    private static ValidationResult runGuarded(ValidationStep step) {
        try {
            ValidationResult result = step.execute();
            if (result == null) {
                return ValidationResult.failure(step.kind().reasonToken() + UNEXPECTED_ERROR_SUFFIX,
                        "Step returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Step {} threw", step.kind().wireName(), e);
            return ValidationResult.failure(step.kind().reasonToken() + UNEXPECTED_ERROR_SUFFIX,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
