package com.evolver.core.patch;

import com.evolver.core.model.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of applying a list of instructions.
 *
 * @param result       overall result; on failure, the first failing instruction's result
 * @param fileStatuses per-file status in application order ({@code applied} or {@code failed: <REASON>})
 * @param appliedCount instructions applied before the run stopped
 */
public record ApplyReport(ValidationResult result, Map<String, String> fileStatuses, int appliedCount) {

    public ApplyReport {
        fileStatuses = Collections.unmodifiableMap(new LinkedHashMap<>(fileStatuses));
    }
}
