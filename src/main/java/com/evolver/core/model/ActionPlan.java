package com.evolver.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The planner's answer to an objective: a free-text analysis and the ordered edits to apply.
 * A {@code null} patch list marks the plan as unusable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionPlan(
    String analysis,
    @JsonAlias("patches_to_apply") List<PatchInstruction> patches
) implements Serializable {

    public ActionPlan {
        if (patches != null) {
            patches = List.copyOf(new ArrayList<>(patches));
        }
    }

    public boolean isUsable() {
        return patches != null;
    }

    /** Distinct file paths touched by the plan, in first-seen order. */
    public Set<String> affectedFiles() {
        var files = new LinkedHashSet<String>();
        if (patches != null) {
            for (var patch : patches) {
                if (patch.filePath() != null && !patch.filePath().isBlank()) {
                    files.add(patch.filePath());
                }
            }
        }
        return files;
    }
}
