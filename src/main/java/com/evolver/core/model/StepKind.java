package com.evolver.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Every validation step the engine knows how to build. Strategy configuration refers to
 * steps by their wire name (or one of its aliases).
 */
public enum StepKind {
    APPLY_PATCHES_TO_DISK("apply_patches_to_disk", true, "PatchApplicatorStep"),
    VALIDATE_SYNTAX("validate_syntax", false),
    VALIDATE_JSON_SYNTAX("validate_json_syntax", false, "ValidateJsonSyntax"),
    RUN_PYTEST_VALIDATION("run_pytest_validation", false, "run_pytest"),
    RUN_PYTEST_NEW_FILE("run_pytest_new_file", false),
    CHECK_FILE_EXISTENCE("check_file_existence", false);

    private final String wireName;
    private final boolean modifiesDisk;
    private final List<String> aliases;

    StepKind(String wireName, boolean modifiesDisk, String... aliases) {
        this.wireName = wireName;
        this.modifiesDisk = modifiesDisk;
        this.aliases = List.of(aliases);
    }

    public String wireName() {
        return wireName;
    }

    public boolean modifiesDisk() {
        return modifiesDisk;
    }

    /** Upper-cased wire name used to build reason codes such as {@code REGRESSION_DETECTED_BY_RUN_PYTEST_VALIDATION}. */
    public String reasonToken() {
        return wireName.toUpperCase(Locale.ROOT);
    }

    public static Optional<StepKind> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(k -> k.wireName.equalsIgnoreCase(trimmed)
                        || k.name().equalsIgnoreCase(trimmed)
                        || k.aliases.stream().anyMatch(a -> a.equalsIgnoreCase(trimmed)))
                .findFirst();
    }
}
