package com.evolver.core.engine;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.config.JsonMappers;
import com.evolver.core.ledger.FailureLedger;
import com.evolver.core.memory.EvolutionLog;
import com.evolver.core.memory.EvolutionLogRow;
import com.evolver.core.memory.EvolutionMemory;
import com.evolver.core.metrics.EvolverMetrics;
import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.OutcomeStatus;
import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.StrategyDecision;
import com.evolver.core.patch.PatchApplicator;
import com.evolver.core.patch.PatchReasons;
import com.evolver.core.planning.ObjectiveGenerator;
import com.evolver.core.planning.Planner;
import com.evolver.core.planning.PlanningException;
import com.evolver.core.planning.StrategySelector;
import com.evolver.core.process.RecordingProcessRunner;
import com.evolver.core.queue.ObjectiveQueue;
import com.evolver.core.scanner.ManifestGenerator;
import com.evolver.core.validation.StrategyCatalog;
import com.evolver.core.validation.StrategyProperties;
import com.evolver.core.validation.ValidationConfig;
import com.evolver.core.validation.ValidationPipeline;
import com.evolver.core.validation.ValidationReasons;
import com.evolver.core.validation.ValidationStepRegistry;
import com.evolver.core.vcs.GitGateway;
import com.evolver.core.vcs.GitResult;
import com.evolver.sandbox.PromotionManager;
import com.evolver.sandbox.SandboxManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives {@link CycleEngine} against a real temporary project. Planning, strategy selection,
 * objective generation and git are mocked; patching, sandboxing, promotion, validation,
 * memory and the evolution log are real.
 */
class CycleEngineTest {

    private static final String ORIGINAL = "def greet():\n    return 'hi'\n";

    @TempDir
    Path root;

    private EvolverProperties properties;
    private Planner planner;
    private StrategySelector selector;
    private ObjectiveGenerator generator;
    private GitGateway git;
    private RecordingProcessRunner runner;
    private EvolutionMemory memory;
    private FailureLedger ledger;
    private ObjectiveQueue queue;
    private SimpleMeterRegistry registry;
    private CycleEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("app.py"), ORIGINAL);

        properties = new EvolverProperties();
        properties.getProject().setRoot(root.toString());
        properties.getEngine().setGenerateFollowUps(false);

        var strategies = new StrategyProperties();
        strategies.getStrategies().put("APPLY_ONLY", new StrategyProperties.Definition(
                List.of("apply_patches_to_disk"), "skip_sanity_check"));
        strategies.getStrategies().put("APPLY_AND_TEST", new StrategyProperties.Definition(
                List.of("apply_patches_to_disk", "run_pytest_validation"), "run_pytest_validation"));
        strategies.getStrategies().put("AUTO_CORRECTION_STRATEGY", new StrategyProperties.Definition(
                List.of("apply_patches_to_disk"), "skip_sanity_check"));
        strategies.getStrategies().put("DISCARD", new StrategyProperties.Definition(List.of(), "skip_sanity_check"));

        ObjectMapper mapper = JsonMappers.create();
        Clock clock = Clock.systemUTC();
        runner = new RecordingProcessRunner();
        var registryOfSteps = new ValidationStepRegistry(
                ValidationConfig.defaultFactories(new PatchApplicator(), runner, mapper, properties));

        planner = mock(Planner.class);
        selector = mock(StrategySelector.class);
        generator = mock(ObjectiveGenerator.class);
        git = mock(GitGateway.class);
        when(git.status()).thenReturn(new GitResult(true, " M app.py\n"));
        when(git.addAll()).thenReturn(new GitResult(true, ""));
        when(git.commit(anyString())).thenReturn(new GitResult(true, "[main abc123] evolve"));
        when(git.hardResetAndCheckout()).thenReturn(new GitResult(true, "HEAD is now at abc123"));

        memory = new EvolutionMemory(properties, mapper, clock);
        ledger = new FailureLedger(memory, clock, properties);
        queue = new ObjectiveQueue();
        registry = new SimpleMeterRegistry();

        engine = new CycleEngine(new EngineContext(
                properties, planner, selector, generator,
                new ManifestGenerator(properties),
                new StrategyCatalog(strategies, registryOfSteps),
                new ValidationPipeline(registryOfSteps),
                new SandboxManager(properties),
                new PromotionManager(),
                git, ledger, memory,
                new EvolutionLog(properties),
                queue,
                new EvolverMetrics(registry),
                mapper, clock));
    }

    private void planReturns(PatchInstruction... patches) {
        when(planner.plan(anyString(), anyString(), anyString()))
                .thenReturn(new ActionPlan("analysis", List.of(patches)));
    }

    private void selectorReturns(String key) {
        when(selector.select(any(), any())).thenReturn(StrategyDecision.strategy(key));
    }

    private String read(String name) throws IOException {
        return Files.readString(root.resolve(name));
    }

    /** Project files outside engine state, relative and sorted. */
    private List<String> projectFiles() throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .filter(p -> !p.startsWith(".evolver/"))
                    .sorted()
                    .toList();
        }
    }

    // --- happy path ---

    @Test
    @DisplayName("validated change is promoted and committed")
    void successfulCyclePromotesAndCommits() throws IOException {
        planReturns(PatchInstruction.insert("feature.py", "FEATURE = True\n", null));
        selectorReturns("APPLY_ONLY");

        CycleOutcome outcome = engine.runCycle("Add a feature flag");

        assertTrue(outcome.success());
        assertEquals(PromotionManager.APPLIED_AND_VALIDATED_SANDBOX, outcome.reasonCode());
        assertEquals("APPLY_ONLY", outcome.strategyKey());
        assertEquals("FEATURE = True\n", read("feature.py"));
        verify(git).addAll();
        verify(git).commit(anyString());
        verify(git, never()).hardResetAndCheckout();
        assertEquals("applied", engine.state().fileStatuses().get("feature.py"));
    }

    @Test
    void successIsRecordedInMemoryLedgerAndLog() {
        planReturns(PatchInstruction.insert("feature.py", "x = 1\n", null));
        selectorReturns("APPLY_ONLY");

        engine.runCycle("Add x");

        assertEquals("Add x", memory.snapshot().completedObjectives().get(0).objective());
        assertEquals(OutcomeStatus.SUCCESS, memory.recentLogNewestFirst().get(0).status());
        assertTrue(Files.exists(properties.getMemoryFile()));

        List<EvolutionLogRow> rows = new EvolutionLog(properties).readAll();
        assertEquals(1, rows.size());
        assertEquals("SUCCESS", rows.get(0).status());
        assertEquals("APPLY_ONLY", rows.get(0).strategy());
        assertEquals(1.0, registry.find("evolver.cycles.total").tag("status", "success").counter().count());
    }

    @Test
    void followUpObjectiveIsQueuedAfterSuccess() {
        properties.getEngine().setGenerateFollowUps(true);
        planReturns(PatchInstruction.insert("feature.py", "x = 1\n", null));
        selectorReturns("APPLY_ONLY");
        when(generator.nextObjective(anyString(), anyString())).thenReturn("  Document the feature flag  ");

        CycleOutcome outcome = engine.runCycle("Add x");

        assertEquals(List.of("Document the feature flag"), outcome.pushedObjectives());
        assertEquals("Document the feature flag", queue.pop());
    }

    @Test
    void cleanStatusSkipsTheCommit() {
        when(git.status()).thenReturn(new GitResult(true, ""));
        planReturns(PatchInstruction.replace("app.py", null, ORIGINAL));
        selectorReturns("APPLY_ONLY");

        CycleOutcome outcome = engine.runCycle("Rewrite app.py unchanged");

        assertTrue(outcome.success());
        verify(git, never()).commit(anyString());
    }

    // --- promotion atomicity ---

    @Test
    @DisplayName("a failing sandbox run leaves the real tree byte-identical")
    void sandboxFailureLeavesTreeUntouched() throws IOException {
        List<String> before = projectFiles();
        runner.willReturn(1, "FAILED tests/test_app.py::test_greet");
        planReturns(
                PatchInstruction.replace("app.py", "'hi'", "'hello'"),
                PatchInstruction.insert("extra.py", "y = 2\n", null));
        selectorReturns("APPLY_AND_TEST");

        CycleOutcome outcome = engine.runCycle("Change greeting");

        assertFalse(outcome.success());
        assertEquals("PYTEST_FAILURE_IN_SANDBOX", outcome.reasonCode());
        assertEquals(ORIGINAL, read("app.py"));
        assertEquals(before, projectFiles());
        assertNotEquals(root, runner.workDirs().get(0));
        verify(git, never()).addAll();
        verify(git, never()).hardResetAndCheckout();
    }

    @Test
    @DisplayName("patches that do not apply stop the pipeline before any test runs")
    void blockNotFoundStopsBeforeTests() throws IOException {
        planReturns(PatchInstruction.replace("app.py", "no such text", "x"));
        selectorReturns("APPLY_AND_TEST");

        CycleOutcome outcome = engine.runCycle("Broken patch");

        assertEquals(PatchReasons.BLOCK_NOT_FOUND, outcome.reasonCode());
        assertTrue(runner.commands().isEmpty());
        assertEquals(ORIGINAL, read("app.py"));
    }

    // --- sanity check and rollback ---

    @Nested
    @DisplayName("when the sanity check fails after promotion")
    class Regression {

        @BeforeEach
        void restoreOnReset() {
            when(git.hardResetAndCheckout()).thenAnswer(invocation -> {
                Files.writeString(root.resolve("app.py"), ORIGINAL);
                return new GitResult(true, "HEAD is now at abc123");
            });
            runner.willReturn(0, "3 passed").willReturn(1, "1 failed");
            planReturns(
                    PatchInstruction.replace("app.py", "'hi'", "'hello'"),
                    PatchInstruction.insert("pkg/new_module.py", "NEW = 1\n", null));
            selectorReturns("APPLY_AND_TEST");
        }

        @Test
        void reportsRegressionAndRollsBack() throws IOException {
            CycleOutcome outcome = engine.runCycle("Change greeting");

            assertFalse(outcome.success());
            assertTrue(outcome.reasonCode().startsWith(CycleReasons.REGRESSION_PREFIX));
            assertEquals("REGRESSION_DETECTED_BY_RUN_PYTEST_VALIDATION", outcome.reasonCode());
            verify(git).hardResetAndCheckout();
            verify(git, never()).commit(anyString());
            assertEquals(ORIGINAL, read("app.py"));
            assertFalse(Files.exists(root.resolve("pkg/new_module.py")));
            assertFalse(Files.exists(root.resolve("pkg")), "directory created by promotion is removed");
        }

        @Test
        void rollbackKeepsDirectoriesThatExistedBefore() throws IOException {
            Files.createDirectories(root.resolve("pkg"));

            engine.runCycle("Change greeting");

            assertFalse(Files.exists(root.resolve("pkg/new_module.py")));
            assertTrue(Files.isDirectory(root.resolve("pkg")));
        }

        @Test
        void sanityCheckRunsOnTheProjectRoot() {
            engine.runCycle("Change greeting");

            assertEquals(2, runner.commands().size());
            assertNotEquals(root, runner.workDirs().get(0));
            assertEquals(root, runner.workDirs().get(1));
        }

        @Test
        void queuesCorrectionAheadOfOriginal() {
            engine.runCycle("Change greeting");

            String correction = queue.pop();
            assertTrue(correction.startsWith(ObjectivePrefixes.CORRECTION));
            assertTrue(correction.contains("REGRESSION_DETECTED_BY_RUN_PYTEST_VALIDATION"));
            assertTrue(correction.contains(ObjectivePrefixes.TEST_FIX_FLAG));
            assertEquals("Change greeting", queue.pop());
            assertEquals(1.0, registry.find("evolver.rollbacks.total").counter().count());
        }
    }

    @Test
    void commitFailureRollsBack() {
        when(git.commit(anyString())).thenReturn(new GitResult(false, "error: gpg failed to sign the data"));
        planReturns(PatchInstruction.insert("created.py", "z = 3\n", null));
        selectorReturns("APPLY_ONLY");

        CycleOutcome outcome = engine.runCycle("Add z");

        assertEquals(CycleReasons.COMMIT_FAILED_POST_SANITY, outcome.reasonCode());
        verify(git).hardResetAndCheckout();
        assertFalse(Files.exists(root.resolve("created.py")));
    }

    @Test
    @DisplayName("patches aimed at version-control metadata never reach the real tree")
    void patchIntoGitMetadataIsRejected() throws IOException {
        Files.createDirectories(root.resolve(".git"));
        Files.writeString(root.resolve(".git/HEAD"), "ref: refs/heads/main\n");
        Files.writeString(root.resolve(".git/config"), "[core]\n");
        planReturns(
                PatchInstruction.delete(".git/HEAD", null),
                PatchInstruction.replace(".git/config", null, "garbage"));
        selectorReturns("APPLY_ONLY");

        CycleOutcome outcome = engine.runCycle("Tidy repository");

        assertFalse(outcome.success());
        assertEquals(PatchReasons.INVALID_PATCH_PATH, outcome.reasonCode());
        assertEquals("ref: refs/heads/main\n", read(".git/HEAD"));
        assertEquals("[core]\n", read(".git/config"));
        verify(git, never()).commit(anyString());
    }

    // --- degenerate loop ---

    @Test
    @DisplayName("an objective that keeps failing is discarded and never re-queued")
    void degenerateObjectiveIsDiscarded() {
        planReturns(PatchInstruction.replace("app.py", "missing", "x"));
        selectorReturns("APPLY_ONLY");

        for (int i = 0; i < 3; i++) {
            assertEquals(PatchReasons.BLOCK_NOT_FOUND, engine.runCycle("Keep failing").reasonCode());
        }
        queue.clear();

        CycleOutcome outcome = engine.runCycle("Keep failing");

        assertEquals(CycleReasons.DEGENERATIVE_LOOP_DETECTED, outcome.reasonCode());
        assertTrue(outcome.pushedObjectives().isEmpty());
        assertTrue(queue.isEmpty());
        verify(planner, times(3)).plan(anyString(), anyString(), anyString());
        assertEquals(1.0, registry.find("evolver.degenerate_loops.total").counter().count());
    }

    // --- planning and strategy selection ---

    @Test
    void planningFailureIsTerminal() {
        when(planner.plan(anyString(), anyString(), anyString())).thenThrow(new PlanningException("model offline"));

        CycleOutcome outcome = engine.runCycle("Anything");

        assertEquals(CycleReasons.PLANNING_FAILED, outcome.reasonCode());
        assertTrue(queue.isEmpty());
        verifyNoInteractions(selector);
        assertEquals(1, new EvolutionLog(properties).readAll().size());
    }

    @Test
    void planWithoutPatchListIsPlanningFailure() {
        when(planner.plan(anyString(), anyString(), anyString())).thenReturn(new ActionPlan("nothing", null));

        assertEquals(CycleReasons.PLANNING_FAILED, engine.runCycle("Anything").reasonCode());
    }

    @Test
    void selectorFailureIsTerminal() {
        planReturns(PatchInstruction.insert("a.py", "a", null));
        when(selector.select(any(), any())).thenThrow(new IllegalStateException("no key"));

        CycleOutcome outcome = engine.runCycle("Anything");

        assertEquals(CycleReasons.STRATEGY_SELECTION_FAILED, outcome.reasonCode());
        assertTrue(queue.isEmpty());
    }

    @Test
    void unknownStrategyIsTerminal() {
        planReturns(PatchInstruction.insert("a.py", "a", null));
        selectorReturns("MADE_UP");

        CycleOutcome outcome = engine.runCycle("Anything");

        assertEquals(ValidationReasons.UNKNOWN_STRATEGY, outcome.reasonCode());
        assertTrue(queue.isEmpty());
        assertFalse(Files.exists(root.resolve("a.py")));
    }

    @Test
    void capabilityGapQueuesCapacitationBeforeOriginal() {
        planReturns();
        when(selector.select(any(), any())).thenReturn(StrategyDecision.capacitation());
        when(generator.capacitationObjective(anyString(), anyString())).thenReturn("Add a YAML parser helper");

        CycleOutcome outcome = engine.runCycle("Read config.yaml");

        assertFalse(outcome.success());
        assertEquals(StrategyDecision.CAPACITATION_REQUIRED, outcome.reasonCode());
        assertEquals(ObjectivePrefixes.CAPACITATION + " Add a YAML parser helper", queue.pop());
        assertEquals("Read config.yaml", queue.pop());
        assertTrue(queue.isEmpty());
    }

    @Test
    void correctionObjectiveUsesTheCorrectionStrategy() throws IOException {
        planReturns(PatchInstruction.insert("fix.py", "ok = True\n", null));

        CycleOutcome outcome = engine.runCycle(ObjectivePrefixes.CORRECTION + " Original objective: x");

        assertTrue(outcome.success());
        assertEquals("AUTO_CORRECTION_STRATEGY", outcome.strategyKey());
        verifyNoInteractions(selector);
        assertEquals("ok = True\n", read("fix.py"));
    }

    @Test
    void missingCorrectionStrategyIsConfigError() {
        properties.getEngine().setCorrectionStrategy("NOT_CONFIGURED");
        planReturns(PatchInstruction.insert("fix.py", "ok", null));

        CycleOutcome outcome = engine.runCycle(ObjectivePrefixes.CORRECTION + " fix it");

        assertEquals(CycleReasons.CONFIG_ERROR, outcome.reasonCode());
    }

    @Test
    void strategyWithoutStepsDiscardsWithoutSandbox() {
        planReturns(PatchInstruction.insert("a.py", "a", null));
        selectorReturns("DISCARD");

        CycleOutcome outcome = engine.runCycle("Pointless change");

        assertTrue(outcome.success());
        assertEquals(ValidationReasons.DISCARDED, outcome.reasonCode());
        assertFalse(Files.exists(root.resolve("a.py")));
        verifyNoInteractions(git);
    }

    // --- error path ---

    @Test
    @DisplayName("an unexpected exception still produces a recorded outcome")
    void unexpectedExceptionIsRecorded() {
        planReturns(PatchInstruction.insert("feature.py", "x\n", null));
        selectorReturns("APPLY_ONLY");
        when(git.status()).thenThrow(new IllegalStateException("git exploded"));

        CycleOutcome outcome = engine.runCycle("Add x");

        assertEquals(CycleReasons.UNEXPECTED_CYCLE_ERROR, outcome.reasonCode());
        assertTrue(outcome.result().details().contains("git exploded"));
        verify(git).hardResetAndCheckout();
        assertFalse(Files.exists(root.resolve("feature.py")));
        List<EvolutionLogRow> rows = new EvolutionLog(properties).readAll();
        assertEquals(CycleReasons.UNEXPECTED_CYCLE_ERROR, rows.get(0).reasonCode());
        assertEquals("Add x", memory.snapshot().failedObjectives().get(0).objective());
    }

    @Test
    void cycleNumbersIncrease() {
        when(planner.plan(anyString(), anyString(), anyString())).thenThrow(new PlanningException("x"));

        assertEquals(1, engine.runCycle("a").cycle());
        assertEquals(2, engine.runCycle("b").cycle());
    }
}
