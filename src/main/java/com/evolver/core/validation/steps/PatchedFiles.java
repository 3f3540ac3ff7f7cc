package com.evolver.core.validation.steps;

import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.PatchOperation;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class PatchedFiles {

    private PatchedFiles() {}

    static Set<String> distinct(List<PatchInstruction> patches) {
        var files = new LinkedHashSet<String>();
        for (var patch : patches) {
            if (patch.filePath() != null && !patch.filePath().isBlank()) {
                files.add(patch.filePath());
            }
        }
        return files;
    }

    /** Files whose last instruction is not a whole-file DELETE, so they should exist afterwards. */
    static Set<String> expectedToExist(List<PatchInstruction> patches) {
        Map<String, PatchInstruction> last = new LinkedHashMap<>();
        for (var patch : patches) {
            if (patch.filePath() != null && !patch.filePath().isBlank()) {
                last.put(patch.filePath(), patch);
            }
        }
        var files = new LinkedHashSet<String>();
        last.forEach((file, patch) -> {
            if (!(patch.operation() == PatchOperation.DELETE && patch.targetsWholeFile())) {
                files.add(file);
            }
        });
        return files;
    }
}
