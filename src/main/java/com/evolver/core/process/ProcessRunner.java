package com.evolver.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (git, python, pytest) with an explicit timeout.
 * <p>
 * Stderr is merged into stdout so tool output keeps its chronological order.
 * A reader thread drains the stream so a chatty process never blocks on a full pipe.
 */
@Component
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final long READER_JOIN_MS = 1000;

    public CommandResult run(List<String> command, Path workDir, Duration timeout) {
        long start = System.currentTimeMillis();
        log.debug("Executing in {}: {}", workDir, String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("Failed to start '{}': {}", command.get(0), e.getMessage());
            return CommandResult.failedToStart("Failed to start " + command.get(0) + ": " + e.getMessage(),
                    System.currentTimeMillis() - start);
        }

        var output = new StringBuffer();
        Thread reader = new Thread(() -> drain(process, output), "process-output-reader");
        reader.setDaemon(true);
        reader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(READER_JOIN_MS);
                long elapsed = System.currentTimeMillis() - start;
                log.warn("'{}' timed out after {}s", String.join(" ", command), timeout.toSeconds());
                output.append("TIMEOUT after ").append(timeout.toSeconds()).append(" seconds");
                return new CommandResult(-1, output.toString(), true, elapsed);
            }
            reader.join(READER_JOIN_MS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new CommandResult(-1, output + "Interrupted", false, System.currentTimeMillis() - start);
        }

        int exitCode = process.exitValue();
        long elapsed = System.currentTimeMillis() - start;
        log.debug("Exit code {} after {}ms ({} chars of output)", exitCode, elapsed, output.length());
        return new CommandResult(exitCode, output.toString(), false, elapsed);
    }

    private static void drain(Process process, StringBuffer sink) {
        try (var reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                sink.append(line).append('\n');
            }
        } catch (IOException e) {
            // Stream closes abruptly when a timed-out process is destroyed.
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }
}
