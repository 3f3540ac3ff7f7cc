package com.evolver.core.validation.steps;

import com.evolver.core.config.JsonMappers;
import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.StepKind;
import com.evolver.core.process.RecordingProcessRunner;
import com.evolver.core.validation.StepContext;
import com.evolver.core.validation.ValidationReasons;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxValidationStepTest {

    @TempDir
    Path base;

    private RecordingProcessRunner runner;

    @BeforeEach
    void setUp() {
        runner = new RecordingProcessRunner();
    }

    private SyntaxValidationStep step(List<PatchInstruction> patches, boolean inSandbox, boolean jsonOnly) {
        return new SyntaxValidationStep(new StepContext(base, patches, inSandbox), runner,
                JsonMappers.create(), "python3", Duration.ofSeconds(5), jsonOnly);
    }

    @Test
    void noPatchesIsSkipped() {
        var result = step(List.of(), false, false).execute();

        assertTrue(result.success());
        assertEquals(ValidationReasons.SYNTAX_VALIDATION_SKIPPED, result.reasonCode());
        assertTrue(runner.commands().isEmpty());
    }

    @Test
    void compilesPythonFilesWithPyCompile() throws IOException {
        Files.writeString(base.resolve("a.py"), "x = 1\n");

        var result = step(List.of(PatchInstruction.insert("a.py", "y = 2", null)), true, false).execute();

        assertTrue(result.success());
        assertEquals(ValidationReasons.SYNTAX_VALIDATION_SUCCESS, result.reasonCode());
        assertEquals(List.of("python3", "-m", "py_compile", "a.py"), runner.lastCommand());
        assertEquals(base, runner.workDirs().get(0));
    }

    @Test
    void pythonSyntaxErrorInSandboxIsQualified() throws IOException {
        Files.writeString(base.resolve("a.py"), "def broken(:\n");
        runner.willReturn(1, "SyntaxError: invalid syntax");

        var result = step(List.of(PatchInstruction.replace("a.py", null, "def broken(:\n")), true, false).execute();

        assertFalse(result.success());
        assertEquals("SYNTAX_VALIDATION_FAILED_IN_SANDBOX", result.reasonCode());
        assertTrue(result.details().contains("SyntaxError"));
    }

    @Test
    void invalidJsonFailsWithoutSubprocess() throws IOException {
        Files.writeString(base.resolve("config.json"), "{\"a\": ");

        var result = step(List.of(PatchInstruction.replace("config.json", null, "{\"a\": ")), false, false).execute();

        assertFalse(result.success());
        assertEquals(ValidationReasons.SYNTAX_VALIDATION_FAILED, result.reasonCode());
        assertTrue(runner.commands().isEmpty());
    }

    @Test
    void jsonOnlyIgnoresPythonFiles() throws IOException {
        Files.writeString(base.resolve("a.py"), "x = 1\n");
        Files.writeString(base.resolve("b.json"), "{\"ok\": true}");

        var result = step(List.of(
                PatchInstruction.insert("a.py", "x", null),
                PatchInstruction.replace("b.json", null, "{\"ok\": true}")), false, true).execute();

        assertTrue(result.success());
        assertEquals(ValidationReasons.JSON_SYNTAX_VALIDATION_SUCCESS, result.reasonCode());
        assertEquals(StepKind.VALIDATE_JSON_SYNTAX, step(List.of(), false, true).kind());
        assertTrue(runner.commands().isEmpty());
    }

    @Test
    void deletedFilesAreNotChecked() {
        var result = step(List.of(PatchInstruction.delete("gone.py", null)), true, false).execute();

        assertTrue(result.success());
        assertTrue(runner.commands().isEmpty());
    }
}
