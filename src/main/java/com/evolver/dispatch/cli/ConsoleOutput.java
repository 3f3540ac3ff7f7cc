package com.evolver.dispatch.cli;

import com.evolver.core.engine.CycleOutcome;
import com.evolver.core.engine.LoopSummary;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for Evolver CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) EVOLVER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [EVOLVER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void cycle(CycleOutcome outcome) {
        String status = outcome.success() ? "@|fg(green) OK  |@" : "@|fg(red) FAIL|@";
        String objective = HistoryCommand.truncate(outcome.objective(), 60);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) [CYCLE " + outcome.cycle() + "]|@ " + status + " "
                + outcome.reasonCode() + " (" + formatDuration(outcome.elapsed().toMillis()) + ") " + objective));
        if (!outcome.pushedObjectives().isEmpty()) {
            System.out.println("      queued " + outcome.pushedObjectives().size() + " objective(s)");
        }
    }

    public static void summary(LoopSummary summary) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Cycles: " + summary.cycles() + ", @|fg(green) " + summary.successes() + " succeeded|@, @|fg(red) "
                + summary.failures() + " failed|@" + (summary.stoppedByRequest() ? " (stopped)" : "")));
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
