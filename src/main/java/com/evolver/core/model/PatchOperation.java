package com.evolver.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

/**
 * Kind of edit a {@link PatchInstruction} performs.
 */
public enum PatchOperation {
    INSERT,
    REPLACE,
    DELETE;

    /**
     * Lenient parse used when reading plans. Accepts {@code DELETE_BLOCK} as an alias of {@link #DELETE}.
     */
    @JsonCreator
    public static PatchOperation fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("DELETE_BLOCK".equals(normalized)) {
            return DELETE;
        }
        return PatchOperation.valueOf(normalized);
    }
}
