package com.evolver.core.process;

/**
 * Result of a blocking subprocess call. Stdout and stderr are merged in {@code output}.
 *
 * @param exitCode  process exit code, {@code -1} on timeout or when the process could not start
 * @param output    merged stdout/stderr captured verbatim
 * @param timedOut  true when the process was killed after its timeout
 * @param elapsedMs wall-clock time in milliseconds
 */
public record CommandResult(int exitCode, String output, boolean timedOut, long elapsedMs) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }

    public static CommandResult failedToStart(String message, long elapsedMs) {
        return new CommandResult(-1, message, false, elapsedMs);
    }
}
