package com.evolver.core.vcs;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.process.CommandResult;
import com.evolver.core.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Version control operations on the real project tree.
 *
 * <p>Shells out to the {@code git} CLI through {@link ProcessRunner} rather than depending
 * on JGit. Every call blocks for at most the configured git timeout.
 */
@Service
public class GitGateway {

    private static final Logger log = LoggerFactory.getLogger(GitGateway.class);

    private final ProcessRunner processRunner;
    private final Path projectRoot;
    private final Duration timeout;
    private final String stateExclude;

    @Autowired
    public GitGateway(ProcessRunner processRunner, EvolverProperties properties) {
        this(processRunner, properties.getProjectRoot(), properties.getGitTimeout(),
                properties.getProject().getStateDir());
    }

    protected GitGateway(ProcessRunner processRunner, Path projectRoot, Duration timeout, String stateDir) {
        this.processRunner = processRunner;
        this.projectRoot = projectRoot;
        this.timeout = timeout;
        this.stateExclude = "/" + stateDir.replace('\\', '/').replaceAll("^\\./", "").replaceAll("/+$", "") + "/";
    }

    public GitResult addAll() {
        return runGit("add", ".");
    }

    public GitResult commit(String message) {
        GitResult result = runGit("commit", "-m", message);
        if (result.success()) {
            log.info("Committed: {}", firstLine(message));
        } else {
            log.warn("Commit failed: {}", result.output().strip());
        }
        return result;
    }

    /**
     * Discards uncommitted changes to tracked files: {@code git checkout -- .} then
     * {@code git reset --hard}. Untracked files are left alone.
     */
    public GitResult hardResetAndCheckout() {
        log.warn("Rolling back working tree in {}", projectRoot);
        GitResult checkout = runGit("checkout", "--", ".");
        GitResult reset = runGit("reset", "--hard");
        String output = checkout.output() + reset.output();
        return new GitResult(checkout.success() && reset.success(), output);
    }

    public GitResult status() {
        return runGit("status", "--porcelain");
    }

    public GitResult recentHistory(int count) {
        return runGit("log", "--oneline", "-n", String.valueOf(count));
    }

    public boolean isRepository() {
        return Files.isDirectory(projectRoot.resolve(".git"));
    }

    /**
     * Runs {@code git init} and an initial commit when the project is not yet a repository.
     */
    public GitResult initializeRepository() {
        if (isRepository()) {
            return new GitResult(true, "Already a git repository");
        }
        log.info("Initializing git repository in {}", projectRoot);
        GitResult init = runGit("init");
        if (!init.success()) {
            return init;
        }
        excludeStateDirectory();
        GitResult add = addAll();
        if (!add.success()) {
            return add;
        }
        return runGit("commit", "--allow-empty", "-m", "Initial commit");
    }

    /** Keeps the engine's state directory out of commits. */
    public void excludeStateDirectory() {
        excludeLocally(stateExclude);
    }

    /**
     * Adds {@code pattern} to {@code .git/info/exclude} so engine state never lands in a commit.
     * The exclude file is local to the clone and is not itself tracked.
     */
    public void excludeLocally(String pattern) {
        Path exclude = projectRoot.resolve(".git").resolve("info").resolve("exclude");
        try {
            Files.createDirectories(exclude.getParent());
            List<String> lines = Files.exists(exclude) ? Files.readAllLines(exclude) : List.of();
            if (lines.stream().noneMatch(line -> line.strip().equals(pattern))) {
                Files.writeString(exclude, pattern + System.lineSeparator(),
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                log.info("Excluded {} from version control", pattern);
            }
        } catch (IOException e) {
            log.warn("Could not update {}: {}", exclude, e.getMessage());
        }
    }

    /**
     * Runs a git command in the project root.
     *
     * @param args git arguments (e.g. "commit", "-m", "message")
     * @return success flag (exit code 0) and captured output
     */
    protected GitResult runGit(String... args) {
        var command = new ArrayList<String>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", String.join(" ", command));

        CommandResult result = processRunner.run(command, projectRoot, timeout);
        if (!result.succeeded()) {
            log.debug("git {} exited with {}{}", args[0], result.exitCode(), result.timedOut() ? " (timed out)" : "");
        }
        return new GitResult(result.succeeded(), result.output());
    }

    private static String firstLine(String message) {
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
