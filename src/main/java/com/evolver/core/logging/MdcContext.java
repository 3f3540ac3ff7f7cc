package com.evolver.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Evolver-specific MDC keys for structured logging.
 */
public final class MdcContext {

    static final int OBJECTIVE_LIMIT = 60;

    private MdcContext() {}

    public static void setCycle(long cycle, String objective) {
        MDC.put("cycle", String.valueOf(cycle));
        MDC.put("objective", abbreviate(objective));
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("cycle");
        MDC.remove("objective");
        MDC.remove("phase");
    }

    private static String abbreviate(String objective) {
        if (objective == null) return "";
        String flat = objective.replace('\n', ' ');
        return flat.length() <= OBJECTIVE_LIMIT ? flat : flat.substring(0, OBJECTIVE_LIMIT - 3) + "...";
    }
}
