package com.evolver.core.memory;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.model.FailureLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Persistent memory of what the engine has done: completed and failed objectives,
 * acquired capabilities, and the bounded recent-objectives log the failure ledger reads.
 * <p>
 * All access is synchronized; the CLI may read history while the loop writes.
 */
@Service
public class EvolutionMemory {

    private static final Logger log = LoggerFactory.getLogger(EvolutionMemory.class);

    private static final int SUMMARY_ITEMS = 5;
    private static final int SUMMARY_TEXT_LIMIT = 120;

    private final Path file;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int maxHistory;
    private final int ledgerSize;

    private final List<CompletedObjective> completed = new ArrayList<>();
    private final List<FailedObjective> failed = new ArrayList<>();
    private final LinkedHashSet<String> capabilities = new LinkedHashSet<>();
    private final List<FailureLogEntry> recentLog = new ArrayList<>();

    @Autowired
    public EvolutionMemory(EvolverProperties properties, ObjectMapper mapper, Clock clock) {
        this(properties.getMemoryFile(), mapper, clock,
                properties.getEngine().getHistorySize(), properties.getEngine().getLedgerSize());
    }

    public EvolutionMemory(Path file, ObjectMapper mapper, Clock clock, int maxHistory, int ledgerSize) {
        this.file = file;
        this.mapper = mapper;
        this.clock = clock;
        this.maxHistory = maxHistory;
        this.ledgerSize = ledgerSize;
    }

    /**
     * Loads memory from disk. A missing file leaves memory empty; a corrupt one is
     * logged and replaced by empty memory on the next save.
     */
    public synchronized void load() {
        clear();
        if (!Files.exists(file)) {
            log.info("No memory file at {}, starting fresh", file);
            return;
        }
        try {
            MemorySnapshot snapshot = mapper.readValue(file.toFile(), MemorySnapshot.class);
            addAllNonNull(completed, snapshot.completedObjectives());
            addAllNonNull(failed, snapshot.failedObjectives());
            if (snapshot.acquiredCapabilities() != null) {
                capabilities.addAll(snapshot.acquiredCapabilities());
            }
            addAllNonNull(recentLog, snapshot.recentObjectivesLog());
            trim();
            log.info("Loaded memory: {} completed, {} failed, {} capabilities",
                    completed.size(), failed.size(), capabilities.size());
        } catch (IOException e) {
            log.error("Memory file {} is unreadable, starting with empty memory: {}", file, e.getMessage());
            clear();
        }
    }

    /**
     * Writes memory atomically (temp file, then move).
     *
     * @return false when the write failed; the failure is logged
     */
    public synchronized boolean save() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path tmp = Files.createTempFile(parent, "memory", ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), snapshot());
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            return true;
        } catch (IOException e) {
            log.error("Failed to save memory to {}", file, e);
            return false;
        }
    }

    public synchronized void addCompleted(String objective, String strategy, String details) {
        completed.add(new CompletedObjective(objective, strategy, details, clock.instant()));
        trim();
    }

    public synchronized void addFailed(String objective, String reason, String details) {
        failed.add(new FailedObjective(objective, reason, details, clock.instant()));
        trim();
    }

    public synchronized void addCapability(String capability) {
        capabilities.add(capability);
    }

    public synchronized void appendLog(FailureLogEntry entry) {
        recentLog.add(entry);
        trim();
    }

    public synchronized MemorySnapshot snapshot() {
        return new MemorySnapshot(List.copyOf(completed), List.copyOf(failed),
                List.copyOf(capabilities), List.copyOf(recentLog));
    }

    /** Recent-objectives log, newest entry first. */
    public synchronized List<FailureLogEntry> recentLogNewestFirst() {
        var copy = new ArrayList<>(recentLog);
        Collections.reverse(copy);
        return copy;
    }

    public synchronized Optional<FailedObjective> lastFailureFor(String objective) {
        for (int i = failed.size() - 1; i >= 0; i--) {
            if (failed.get(i).objective().equals(objective)) {
                return Optional.of(failed.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * Short plain-text digest of recent history, for generator prompts.
     */
    public synchronized String historySummary() {
        var sb = new StringBuilder();
        sb.append("Recently completed objectives:\n");
        appendTail(sb, completed.stream().map(c -> c.objective() + " (" + c.strategy() + ")").toList());
        sb.append("Recently failed objectives:\n");
        appendTail(sb, failed.stream().map(f -> f.objective() + " (" + f.reason() + ")").toList());
        sb.append("Acquired capabilities:\n");
        appendTail(sb, List.copyOf(capabilities));
        return sb.toString();
    }

    private static void appendTail(StringBuilder sb, List<String> items) {
        if (items.isEmpty()) {
            sb.append("- none\n");
            return;
        }
        for (String item : items.subList(Math.max(0, items.size() - SUMMARY_ITEMS), items.size())) {
            String line = item.replace('\n', ' ');
            if (line.length() > SUMMARY_TEXT_LIMIT) {
                line = line.substring(0, SUMMARY_TEXT_LIMIT - 3) + "...";
            }
            sb.append("- ").append(line).append('\n');
        }
    }

    private void trim() {
        trimTo(completed, maxHistory);
        trimTo(failed, maxHistory);
        trimTo(recentLog, ledgerSize);
    }

    private static <T> void trimTo(List<T> list, int max) {
        if (max > 0 && list.size() > max) {
            list.subList(0, list.size() - max).clear();
        }
    }

    private static <T> void addAllNonNull(List<T> target, List<T> source) {
        if (source != null) {
            source.stream().filter(Objects::nonNull).forEach(target::add);
        }
    }

    private void clear() {
        completed.clear();
        failed.clear();
        capabilities.clear();
        recentLog.clear();
    }
}
