package com.evolver.dispatch.cli;

import com.evolver.core.memory.EvolutionLog;
import com.evolver.core.memory.EvolutionLogRow;
import com.evolver.core.memory.EvolutionMemory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.List;

/**
 * CLI command: evolver history
 * <p>
 * Reads the evolution log and displays recent cycles as a table:
 * Cycle | Status | Reason | Strategy | Objective (truncated).
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recent cycles")
@Component
public class HistoryCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private int limit = 10;

    @Option(names = {"--memory", "-m"}, description = "Also print the memory summary")
    private boolean showMemory;

    private final EvolutionLog evolutionLog;
    private final EvolutionMemory memory;

    public HistoryCommand(EvolutionLog evolutionLog, EvolutionMemory memory) {
        this.evolutionLog = evolutionLog;
        this.memory = memory;
    }

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    void setLimit(int limit) {
        if (limit < 0) {
            throw new ParameterException(spec.commandLine(), "--limit must not be negative, was " + limit);
        }
        this.limit = limit;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<EvolutionLogRow> rows = evolutionLog.readAll();
        if (rows.isEmpty()) {
            ConsoleOutput.info("No cycles recorded in " + evolutionLog.file());
        } else {
            List<EvolutionLogRow> display = rows.size() > limit
                    ? rows.subList(rows.size() - limit, rows.size())
                    : rows;

            ConsoleOutput.info("Cycles (" + display.size() + " of " + rows.size() + "):");
            System.out.println();
            System.out.printf("  %-6s %-8s %-34s %-26s %s%n", "CYCLE", "STATUS", "REASON", "STRATEGY", "OBJECTIVE");
            System.out.println("  " + "-".repeat(110));
            for (EvolutionLogRow row : display) {
                System.out.printf("  %-6d %-8s %-34s %-26s %s%n", row.cycle(), row.status(),
                        truncate(row.reasonCode(), 34), truncate(row.strategy(), 26), truncate(row.objective(), 40));
            }
        }

        if (showMemory) {
            memory.load();
            System.out.println();
            System.out.print(memory.historySummary());
        }
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        String flat = s.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max - 3) + "...";
    }
}
