package com.evolver.core.engine;

import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable working state of the cycle in progress. Owned by the engine thread.
 */
public class CycleState {

    private String objective;
    private String manifest;
    private ActionPlan plan;
    private String strategyKey;
    private ValidationResult result;
    private final Map<String, String> fileStatuses = new LinkedHashMap<>();
    private CyclePhase phase = CyclePhase.AWAIT_OBJECTIVE;

    public void resetForNewCycle(String objective) {
        this.objective = objective;
        this.manifest = null;
        this.plan = null;
        this.strategyKey = null;
        this.result = ValidationResult.pending("Cycle started");
        this.fileStatuses.clear();
        this.phase = CyclePhase.AWAIT_OBJECTIVE;
    }

    public String objective() { return objective; }
    public String manifest() { return manifest; }
    public void setManifest(String manifest) { this.manifest = manifest; }
    public ActionPlan plan() { return plan; }
    public void setPlan(ActionPlan plan) { this.plan = plan; }
    public String strategyKey() { return strategyKey; }
    public void setStrategyKey(String strategyKey) { this.strategyKey = strategyKey; }
    public ValidationResult result() { return result; }
    public void setResult(ValidationResult result) { this.result = result; }
    public CyclePhase phase() { return phase; }
    public void setPhase(CyclePhase phase) { this.phase = phase; }

    public Map<String, String> fileStatuses() {
        return Collections.unmodifiableMap(fileStatuses);
    }

    public void putFileStatuses(Map<String, String> statuses) {
        fileStatuses.putAll(statuses);
    }
}
