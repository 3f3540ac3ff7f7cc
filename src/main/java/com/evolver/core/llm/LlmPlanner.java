package com.evolver.core.llm;

import com.evolver.core.model.ActionPlan;
import com.evolver.core.planning.Planner;
import com.evolver.core.planning.PlanningException;

/**
 * Asks the LLM for an {@link ActionPlan} of structured patch instructions.
 */
public class LlmPlanner implements Planner {

    static final String SYSTEM_PROMPT = """
            You are the architect of an autonomous agent that improves its own codebase.
            Given an objective and a project manifest, produce a minimal change plan.

            Return an analysis (a short paragraph) and an ordered list of patches.
            Each patch has:
            - operation: INSERT, REPLACE or DELETE
            - filePath: path relative to the project root
            - match: exact text block to find (REPLACE/DELETE). Use null to target the whole file.
            - regex: true only when match is a regular expression
            - content: text to insert or the replacement text
            - lineNumber: 1-based insertion line for INSERT, or null to append

            RULES:
            1. Copy match blocks verbatim from the file contents you were given.
            2. To create a new file use REPLACE with match null and the full content.
            3. Keep each patch focused; do not rewrite files you do not need to touch.
            4. Return an empty patch list when nothing needs to change.
            """;

    private final LlmService llmService;

    public LlmPlanner(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public ActionPlan plan(String objective, String manifest, String fileContext) {
        String userPrompt = """
                Objective:
                %s

                %s

                Relevant file contents:
                %s
                """.formatted(objective, manifest, fileContext == null || fileContext.isBlank() ? "(none)" : fileContext);
        try {
            return llmService.structuredCall(SYSTEM_PROMPT, userPrompt, ActionPlan.class);
        } catch (LlmEmptyResponseException | LlmParseException e) {
            throw new PlanningException("LLM planner failed: " + e.getMessage(), e);
        }
    }
}
