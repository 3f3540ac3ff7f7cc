package com.evolver.core.llm;

import com.evolver.core.planning.ObjectiveGenerator;

/**
 * Plain-text LLM prompts for new objectives and commit messages.
 */
public class LlmObjectiveGenerator implements ObjectiveGenerator {

    private static final String OBJECTIVE_PROMPT = """
            You propose the next improvement for an autonomous agent's own codebase.
            Answer with a single, concrete, testable objective in one or two sentences.
            Do not repeat objectives that were recently completed or failed.
            """;

    private static final String CAPACITATION_PROMPT = """
            A planned change cannot be validated because the agent lacks a capability.
            Propose one objective that gives the agent that capability.
            The objective MUST start with "[CAPACITATION TASK]".
            """;

    private static final String COMMIT_PROMPT = """
            Write a git commit message for the change described below.
            Use an imperative subject line of at most 72 characters, optionally followed
            by a blank line and a short body. Answer with the message only.
            """;

    private final LlmService llmService;

    public LlmObjectiveGenerator(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String nextObjective(String manifest, String memorySummary) {
        return llmService.textCall(OBJECTIVE_PROMPT, manifest + "\n\n" + memorySummary);
    }

    @Override
    public String capacitationObjective(String analysis, String memorySummary) {
        return llmService.textCall(CAPACITATION_PROMPT,
                "Plan analysis:\n" + analysis + "\n\n" + memorySummary);
    }

    @Override
    public String commitMessage(String analysis, String objective) {
        return llmService.textCall(COMMIT_PROMPT,
                "Objective:\n" + objective + "\n\nAnalysis:\n" + analysis);
    }
}
