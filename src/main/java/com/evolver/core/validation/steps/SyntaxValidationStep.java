package com.evolver.core.validation.steps;

import com.evolver.core.model.StepKind;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.process.CommandResult;
import com.evolver.core.process.ProcessRunner;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationStep;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.evolver.core.validation.ValidationReasons.*;

/**
 * Checks the syntax of every patched file that still exists: Python through
 * {@code py_compile}, JSON through Jackson. Other file types pass through.
 * With {@code jsonOnly} set, only JSON files are checked.
 */
public class SyntaxValidationStep implements ValidationStep {

    private static final Logger log = LoggerFactory.getLogger(SyntaxValidationStep.class);

    private final StepContext context;
    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final String pythonExecutable;
    private final Duration timeout;
    private final boolean jsonOnly;

    public SyntaxValidationStep(StepContext context, ProcessRunner processRunner, ObjectMapper objectMapper,
                                String pythonExecutable, Duration timeout, boolean jsonOnly) {
        this.context = context;
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.pythonExecutable = pythonExecutable;
        this.timeout = timeout;
        this.jsonOnly = jsonOnly;
    }

    @Override
    public StepKind kind() {
        return jsonOnly ? StepKind.VALIDATE_JSON_SYNTAX : StepKind.VALIDATE_SYNTAX;
    }

    @Override
    public ValidationResult execute() {
        if (context.patches().isEmpty()) {
            return ValidationResult.success(jsonOnly ? JSON_SYNTAX_VALIDATION_SKIPPED : SYNTAX_VALIDATION_SKIPPED,
                    "No patches to validate");
        }

        var errors = new ArrayList<String>();
        int checked = 0;
        for (String file : PatchedFiles.distinct(context.patches())) {
            Path path = context.basePath().resolve(file).normalize();
            if (!Files.isRegularFile(path)) {
                continue;
            }
            if (file.endsWith(".json")) {
                checked++;
                checkJson(file, path, errors);
            } else if (file.endsWith(".py") && !jsonOnly) {
                checked++;
                checkPython(file, errors);
            }
        }

        if (!errors.isEmpty()) {
            String reason = jsonOnly ? JSON_SYNTAX_VALIDATION_FAILED : SYNTAX_VALIDATION_FAILED;
            return ValidationResult.failure(context.qualify(reason), String.join("\n", errors));
        }
        log.debug("Syntax check passed for {} file(s)", checked);
        return ValidationResult.success(jsonOnly ? JSON_SYNTAX_VALIDATION_SUCCESS : SYNTAX_VALIDATION_SUCCESS,
                "Checked %d file(s)".formatted(checked));
    }

    private void checkJson(String file, Path path, List<String> errors) {
        try {
            objectMapper.readTree(Files.readString(path));
        } catch (JsonProcessingException e) {
            errors.add("Invalid JSON in %s: %s".formatted(file, e.getOriginalMessage()));
        } catch (IOException e) {
            errors.add("Cannot read %s: %s".formatted(file, e.getMessage()));
        }
    }

    private void checkPython(String file, List<String> errors) {
        CommandResult result = processRunner.run(
                List.of(pythonExecutable, "-m", "py_compile", file), context.basePath(), timeout);
        if (!result.succeeded()) {
            errors.add("Syntax error in %s:\n%s".formatted(file, result.output().strip()));
        }
    }
}
