package com.evolver.core.engine;

import com.evolver.core.model.PatchInstruction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Builds the correction objective pushed after a correctable failure.
 */
public class CorrectionObjectiveBuilder {

    private final ObjectMapper mapper;
    private final int detailsLimit;

    public CorrectionObjectiveBuilder(ObjectMapper mapper, int detailsLimit) {
        this.mapper = mapper;
        this.detailsLimit = detailsLimit;
    }

    public String build(String originalObjective, String reasonCode, String details, List<PatchInstruction> patches) {
        var sb = new StringBuilder();
        sb.append(ObjectivePrefixes.CORRECTION)
          .append(" Original objective: ").append(originalObjective).append('\n')
          .append("Failure reason: ").append(reasonCode).append('\n')
          .append("Details:\n").append(truncate(details)).append('\n')
          .append("Previous patches:\n").append(patchesJson(patches));
        if (FailureClassifier.isTestFailure(reasonCode)) {
            sb.append('\n').append(ObjectivePrefixes.TEST_FIX_FLAG);
        }
        return sb.toString();
    }

    private String truncate(String details) {
        if (details == null || details.isBlank()) {
            return "(none)";
        }
        return details.length() <= detailsLimit ? details : details.substring(0, detailsLimit) + "\n... (truncated)";
    }

    private String patchesJson(List<PatchInstruction> patches) {
        if (patches == null || patches.isEmpty()) {
            return "N/A";
        }
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(patches);
        } catch (JsonProcessingException e) {
            return "N/A (" + e.getOriginalMessage() + ")";
        }
    }
}
