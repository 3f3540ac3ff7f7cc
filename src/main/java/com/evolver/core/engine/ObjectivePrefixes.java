package com.evolver.core.engine;

/**
 * Markers embedded in objective text.
 */
public final class ObjectivePrefixes {

    public static final String CORRECTION = "[CORRECTION TASK]";
    public static final String CAPACITATION = "[CAPACITATION TASK]";
    public static final String TEST_FIX_FLAG = "[CONTEXT_FLAG] TEST_FIX_IN_PROGRESS";

    private ObjectivePrefixes() {}

    public static boolean isCorrection(String objective) {
        return objective != null && objective.startsWith(CORRECTION);
    }

    public static boolean isCapacitation(String objective) {
        return objective != null && objective.startsWith(CAPACITATION);
    }

    public static String ensureCapacitationPrefix(String objective) {
        String trimmed = objective.strip();
        return isCapacitation(trimmed) ? trimmed : CAPACITATION + " " + trimmed;
    }

    /** Capacitation objective without its prefix, as stored in acquired capabilities. */
    public static String capabilityName(String objective) {
        return isCapacitation(objective) ? objective.substring(CAPACITATION.length()).strip() : objective.strip();
    }
}
