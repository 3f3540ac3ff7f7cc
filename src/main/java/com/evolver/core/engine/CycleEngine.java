package com.evolver.core.engine;

import com.evolver.core.logging.MdcContext;
import com.evolver.core.memory.EvolutionLogRow;
import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.OutcomeStatus;
import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.StepKind;
import com.evolver.core.model.StrategyDecision;
import com.evolver.core.model.ValidationResult;
import com.evolver.core.model.ValidationStrategy;
import com.evolver.core.validation.PipelineResult;
import com.evolver.core.validation.StrategyResolutionException;
import com.evolver.core.vcs.GitResult;
import com.evolver.sandbox.PromotionReport;
import com.evolver.sandbox.SandboxException;
import com.evolver.sandbox.SandboxHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

import static com.evolver.core.engine.CycleReasons.*;

/**
 * Runs one objective through plan, strategy selection, sandboxed validation,
 * promotion, sanity check and commit (or rollback), then records the outcome.
 *
 * <p>The real project tree changes only after a sandbox run has validated the change.
 * If the post-promotion sanity check or the commit fails, the tree is rolled back to
 * the last commit and files created by the promotion are removed.
 *
 * <p>Not thread-safe: one cycle at a time, driven by {@link EvolutionLoop} or the CLI.
 */
@Service
public class CycleEngine {

    private static final Logger log = LoggerFactory.getLogger(CycleEngine.class);

    private static final int LOG_CONTEXT_LIMIT = 500;

    private final EngineContext ctx;
    private final Path projectRoot;
    private final CorrectionObjectiveBuilder correctionBuilder;
    private final CycleState state = new CycleState();
    private final AtomicLong cycleCounter = new AtomicLong();

    public CycleEngine(EngineContext ctx) {
        this.ctx = ctx;
        this.projectRoot = ctx.properties().getProjectRoot();
        this.correctionBuilder = new CorrectionObjectiveBuilder(ctx.objectMapper(),
                ctx.properties().getEngine().getCorrectionDetailsLimit());
    }

    /**
     * Runs one full cycle for {@code objective}. Never throws for cycle-level failures;
     * the outcome carries the reason code.
     */
    public CycleOutcome runCycle(String objective) {
        long cycle = cycleCounter.incrementAndGet();
        Instant start = ctx.clock().instant();
        state.resetForNewCycle(objective);
        var pushed = new ArrayList<String>();
        boolean degenerate = false;

        MdcContext.setCycle(cycle, objective);
        log.info("Cycle {} started", cycle);
        try {
            if (ctx.ledger().isDegenerate(objective)) {
                degenerate = true;
                ctx.metrics().recordDegenerateLoop();
                state.setResult(ValidationResult.failure(DEGENERATIVE_LOOP_DETECTED,
                        "Objective failed %d consecutive times; discarded".formatted(ctx.ledger().threshold())));
            } else {
                state.setResult(execute(objective, pushed));
                handleOutcome(objective, pushed);
            }
        } catch (RuntimeException e) {
            log.error("Cycle {} aborted by unexpected error", cycle, e);
            state.setResult(ValidationResult.failure(UNEXPECTED_CYCLE_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            if (state.result() == null || state.result().isPending()) {
                state.setResult(ValidationResult.failure(UNEXPECTED_CYCLE_ERROR, "Cycle ended without a result"));
            }
            Instant end = ctx.clock().instant();
            recordOutcome(cycle, objective, start, end, degenerate);
            MdcContext.clear();
        }

        ValidationResult result = state.result();
        log.info("Cycle {} finished: {} ({})", cycle, result.success() ? "SUCCESS" : "FAILURE", result.reasonCode());
        return new CycleOutcome(cycle, objective, result, state.strategyKey(), start, ctx.clock().instant(), pushed);
    }

    /** Read-only view of the last (or current) cycle's state. */
    public CycleState state() {
        return state;
    }

    // --- Phases ---

    private ValidationResult execute(String objective, List<String> pushed) {
        // PLANNING
        phase(CyclePhase.PLANNING);
        String manifest;
        String fileContext;
        try {
            manifest = ctx.manifestGenerator().generate(projectRoot);
            fileContext = ctx.manifestGenerator().fileContext(projectRoot, objective);
        } catch (IOException e) {
            log.error("Manifest generation failed", e);
            return ValidationResult.failure(MANIFEST_GENERATION_FAILED, e.getMessage());
        }
        state.setManifest(manifest);

        ActionPlan plan;
        long planningStart = System.currentTimeMillis();
        try {
            plan = ctx.planner().plan(objective, manifest, fileContext);
        } catch (RuntimeException e) {
            log.error("Planner failed: {}", e.getMessage());
            return ValidationResult.failure(PLANNING_FAILED, e.getMessage());
        } finally {
            ctx.metrics().recordPlanningDuration(System.currentTimeMillis() - planningStart);
        }
        if (plan == null || !plan.isUsable()) {
            return ValidationResult.failure(PLANNING_FAILED, "Planner returned no usable plan");
        }
        state.setPlan(plan);
        log.info("Plan has {} patch(es) touching {}", plan.patches().size(), plan.affectedFiles());

        // STRATEGY_SELECTION
        phase(CyclePhase.STRATEGY_SELECTION);
        String strategyKey;
        if (ObjectivePrefixes.isCorrection(objective)) {
            strategyKey = ctx.properties().getEngine().getCorrectionStrategy();
            if (!ctx.strategyCatalog().contains(strategyKey)) {
                return ValidationResult.failure(CONFIG_ERROR, "Correction strategy not configured: " + strategyKey);
            }
            log.info("Correction objective, using {}", strategyKey);
        } else {
            StrategyDecision decision;
            try {
                decision = ctx.strategySelector().select(plan, failureContext(objective));
            } catch (RuntimeException e) {
                log.error("Strategy selection failed: {}", e.getMessage());
                return ValidationResult.failure(STRATEGY_SELECTION_FAILED, e.getMessage());
            }
            if (decision == null) {
                return ValidationResult.failure(STRATEGY_SELECTION_FAILED, "Selector returned no decision");
            }
            if (decision.capacitationRequired()) {
                phase(CyclePhase.CAPACITATION_BRANCH);
                state.setStrategyKey(StrategyDecision.CAPACITATION_REQUIRED);
                return capacitate(objective, plan, pushed);
            }
            strategyKey = decision.strategyKey();
        }
        state.setStrategyKey(strategyKey);

        ValidationStrategy strategy;
        try {
            strategy = ctx.strategyCatalog().resolve(strategyKey);
        } catch (StrategyResolutionException e) {
            log.error("Cannot resolve strategy {}: {}", strategyKey, e.getMessage());
            return ValidationResult.failure(e.getReasonCode(), e.getMessage());
        }

        // EXECUTE_STRATEGY
        phase(CyclePhase.EXECUTE_STRATEGY);
        List<PatchInstruction> patches = plan.patches();
        if (!strategy.touchesFiles() || patches.isEmpty()) {
            PipelineResult direct = ctx.pipeline().run(strategy, projectRoot, patches, false);
            state.putFileStatuses(direct.fileStatuses());
            ctx.metrics().recordStepCount(strategy.key(), direct.executedSteps().size());
            return direct.result();
        }

        PromotionReport promotion;
        try (SandboxHandle sandbox = ctx.sandboxManager().acquire(projectRoot)) {
            PipelineResult sandboxRun = ctx.pipeline().run(strategy, sandbox.root(), patches, true);
            state.putFileStatuses(sandboxRun.fileStatuses());
            ctx.metrics().recordStepCount(strategy.key(), sandboxRun.executedSteps().size());
            if (!sandboxRun.success() || !sandboxRun.diskModified()) {
                return sandboxRun.result();
            }
            promotion = ctx.promotionManager().promote(sandbox.root(), projectRoot, patches);
        } catch (SandboxException e) {
            log.error("Sandbox setup failed", e);
            return ValidationResult.failure(SANDBOX_SETUP_FAILED, e.getMessage());
        }

        ctx.metrics().recordPromotion(promotion.success());
        if (!promotion.success()) {
            phase(CyclePhase.ROLLBACK);
            rollback(promotion, promotion.result().reasonCode());
            return promotion.result();
        }

        try {
            return checkAndCommit(objective, plan, strategy, promotion);
        } catch (RuntimeException e) {
            // promoted changes must not outlive a crashed cycle
            phase(CyclePhase.ROLLBACK);
            rollback(promotion, UNEXPECTED_CYCLE_ERROR);
            throw e;
        }
    }

    private ValidationResult checkAndCommit(String objective, ActionPlan plan, ValidationStrategy strategy,
                                            PromotionReport promotion) {
        // SANITY_CHECK
        phase(CyclePhase.SANITY_CHECK);
        if (!strategy.sanityCheck().isNone()) {
            StepKind check = strategy.sanityCheck().step();
            log.info("Running sanity check {} on the project root", check.wireName());
            ValidationResult sanity = ctx.pipeline().runSingle(check, projectRoot, plan.patches(), false);
            if (!sanity.success()) {
                phase(CyclePhase.ROLLBACK);
                String reason = REGRESSION_PREFIX + check.reasonToken();
                rollback(promotion, reason);
                return ValidationResult.failure(reason, sanity.reasonCode() + ": " + sanity.details());
            }
        }

        // PROMOTE_COMMIT
        phase(CyclePhase.PROMOTE_COMMIT);
        return commit(objective, plan, promotion);
    }

    private ValidationResult capacitate(String objective, ActionPlan plan, List<String> pushed) {
        String capacitation = null;
        try {
            capacitation = ctx.objectiveGenerator().capacitationObjective(plan.analysis(), ctx.memory().historySummary());
        } catch (RuntimeException e) {
            log.warn("Capacitation objective generation failed: {}", e.getMessage());
        }
        if (capacitation == null || capacitation.isBlank()) {
            capacitation = "Acquire the capability needed for: " + objective;
        }
        capacitation = ObjectivePrefixes.ensureCapacitationPrefix(capacitation);

        push(objective, "original", pushed);
        push(capacitation, "capacitation", pushed);
        log.info("Capability gap: queued capacitation objective ahead of the original");
        return ValidationResult.failure(StrategyDecision.CAPACITATION_REQUIRED,
                "Capability gap; queued: " + capacitation);
    }

    private ValidationResult commit(String objective, ActionPlan plan, PromotionReport promotion) {
        GitResult status = ctx.git().status();
        if (status.success() && status.output().isBlank()) {
            log.info("Promoted content matches the last commit, nothing to commit");
            return ValidationResult.success(promotion.result().reasonCode(),
                    promotion.result().details() + "; nothing to commit");
        }

        String message = commitMessage(plan, objective);
        GitResult add = ctx.git().addAll();
        GitResult commit = add.success() ? ctx.git().commit(message) : add;
        if (!commit.success()) {
            phase(CyclePhase.ROLLBACK);
            rollback(promotion, COMMIT_FAILED_POST_SANITY);
            return ValidationResult.failure(COMMIT_FAILED_POST_SANITY, commit.output());
        }
        return ValidationResult.success(promotion.result().reasonCode(),
                promotion.result().details() + "; committed");
    }

    private void handleOutcome(String objective, List<String> pushed) {
        ValidationResult result = state.result();
        if (result.success()) {
            if (ctx.properties().getEngine().isGenerateFollowUps()) {
                String next = nextObjective();
                if (next != null) {
                    push(next, "follow_up", pushed);
                }
            }
            return;
        }
        if (FailureClassifier.isCorrectable(result.reasonCode())) {
            List<PatchInstruction> patches = state.plan() != null ? state.plan().patches() : List.of();
            String correction = correctionBuilder.build(objective, result.reasonCode(), result.details(), patches);
            push(objective, "original", pushed);
            push(correction, "correction", pushed);
            log.info("Correctable failure {}, queued correction objective", result.reasonCode());
        } else {
            log.info("Terminal failure {}, moving on", result.reasonCode());
        }
    }

    // --- Helpers ---

    private void rollback(PromotionReport promotion, String trigger) {
        log.warn("Rolling back promoted changes ({})", trigger);
        GitResult reset = ctx.git().hardResetAndCheckout();
        if (!reset.success()) {
            log.error("git rollback failed: {}", reset.output().strip());
        }
        for (String created : promotion.createdPaths()) {
            Path path = projectRoot.resolve(created).normalize();
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.error("Could not remove created file {} during rollback", path, e);
            }
        }
        // deepest first, so each directory is empty once its children are gone
        for (String directory : promotion.createdDirectories()) {
            Path path = projectRoot.resolve(directory).normalize();
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Could not remove created directory {} during rollback: {}", path, e.toString());
            }
        }
        ctx.metrics().recordRollback(trigger);
    }

    private String failureContext(String objective) {
        return ctx.memory().lastFailureFor(objective)
                .map(f -> f.reason() + ": " + f.details())
                .orElse(null);
    }

    private String nextObjective() {
        try {
            String manifest = state.manifest() != null ? state.manifest() : ctx.manifestGenerator().generate(projectRoot);
            String next = ctx.objectiveGenerator().nextObjective(manifest, ctx.memory().historySummary());
            return next == null || next.isBlank() ? null : next.strip();
        } catch (IOException | RuntimeException e) {
            log.warn("Could not generate a follow-up objective: {}", e.getMessage());
            return null;
        }
    }

    private String commitMessage(ActionPlan plan, String objective) {
        try {
            String message = ctx.objectiveGenerator().commitMessage(plan.analysis(), objective);
            if (message != null && !message.isBlank()) {
                return message.strip();
            }
        } catch (RuntimeException e) {
            log.warn("Commit message generation failed, using fallback: {}", e.getMessage());
        }
        String firstLine = objective.lines().findFirst().orElse(objective);
        return "evolver: " + (firstLine.length() > 72 ? firstLine.substring(0, 69) + "..." : firstLine);
    }

    private void push(String objective, String kind, List<String> pushed) {
        ctx.queue().push(objective);
        pushed.add(objective);
        ctx.metrics().recordObjectivePushed(kind);
    }

    private void phase(CyclePhase phase) {
        state.setPhase(phase);
        MdcContext.setPhase(phase.name());
        log.debug("Phase {}", phase);
    }

    private void recordOutcome(long cycle, String objective, Instant start, Instant end, boolean degenerate) {
        phase(CyclePhase.RECORD_OUTCOME);
        ValidationResult result = state.result();
        try {
            if (result.success()) {
                ctx.memory().addCompleted(objective, state.strategyKey(), result.details());
                if (ObjectivePrefixes.isCapacitation(objective)) {
                    ctx.memory().addCapability(ObjectivePrefixes.capabilityName(objective));
                }
            } else {
                ctx.memory().addFailed(objective, result.reasonCode(), result.details());
            }
            if (!degenerate) {
                ctx.ledger().record(objective, result.success() ? OutcomeStatus.SUCCESS : OutcomeStatus.FAILURE,
                        result.reasonCode());
            }
            ctx.memory().save();
        } catch (RuntimeException e) {
            log.error("Failed to record outcome in memory", e);
        }

        Duration elapsed = Duration.between(start, end);
        ctx.evolutionLog().append(new EvolutionLogRow(
                cycle,
                objective,
                result.success() ? OutcomeStatus.SUCCESS.name() : OutcomeStatus.FAILURE.name(),
                String.format(Locale.ROOT, "%.2f", elapsed.toMillis() / 1000.0),
                "",
                state.strategyKey() != null ? state.strategyKey() : "",
                start.toString(),
                end.toString(),
                result.reasonCode(),
                abbreviate(result.details())));

        ctx.metrics().recordCycleResult(result.success(), result.reasonCode());
        ctx.metrics().recordCycleDuration(elapsed.toMillis());
        state.setPhase(CyclePhase.AWAIT_OBJECTIVE);
    }

    private static String abbreviate(String details) {
        if (details == null) return "";
        return details.length() <= LOG_CONTEXT_LIMIT ? details : details.substring(0, LOG_CONTEXT_LIMIT) + "...";
    }
}
