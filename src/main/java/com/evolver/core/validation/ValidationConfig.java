package com.evolver.core.validation;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.model.StepKind;
import com.evolver.core.patch.PatchApplicator;
import com.evolver.core.process.ProcessRunner;
import com.evolver.core.validation.steps.ApplyPatchesStep;
import com.evolver.core.validation.steps.FileExistenceStep;
import com.evolver.core.validation.steps.PytestNewFileStep;
import com.evolver.core.validation.steps.PytestValidationStep;
import com.evolver.core.validation.steps.SyntaxValidationStep;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;

@Configuration
public class ValidationConfig {

    /**
     * The production step table. Every {@link StepKind} has a factory here.
     */
    @Bean
    public ValidationStepRegistry validationStepRegistry(PatchApplicator applicator,
                                                         ProcessRunner processRunner,
                                                         ObjectMapper objectMapper,
                                                         EvolverProperties properties) {
        return new ValidationStepRegistry(defaultFactories(applicator, processRunner, objectMapper, properties));
    }

    public static EnumMap<StepKind, StepFactory> defaultFactories(PatchApplicator applicator,
                                                                  ProcessRunner processRunner,
                                                                  ObjectMapper objectMapper,
                                                                  EvolverProperties properties) {
        String python = properties.getPython().getExecutable();
        var factories = new EnumMap<StepKind, StepFactory>(StepKind.class);
        factories.put(StepKind.APPLY_PATCHES_TO_DISK, ctx -> new ApplyPatchesStep(ctx, applicator));
        factories.put(StepKind.VALIDATE_SYNTAX, ctx -> new SyntaxValidationStep(
                ctx, processRunner, objectMapper, python, properties.getSyntaxTimeout(), false));
        factories.put(StepKind.VALIDATE_JSON_SYNTAX, ctx -> new SyntaxValidationStep(
                ctx, processRunner, objectMapper, python, properties.getSyntaxTimeout(), true));
        factories.put(StepKind.RUN_PYTEST_VALIDATION, ctx -> new PytestValidationStep(
                ctx, processRunner, python, properties.getPython().getTestDir(), properties.getTestTimeout()));
        factories.put(StepKind.RUN_PYTEST_NEW_FILE, ctx -> new PytestNewFileStep(
                ctx, processRunner, python, properties.getTestTimeout()));
        factories.put(StepKind.CHECK_FILE_EXISTENCE, FileExistenceStep::new);
        return factories;
    }
}
