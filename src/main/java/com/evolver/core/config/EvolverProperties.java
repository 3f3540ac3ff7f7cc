package com.evolver.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "evolver")
public class EvolverProperties {

    private Project project = new Project();
    private Engine engine = new Engine();
    private Sandbox sandbox = new Sandbox();
    private Process process = new Process();
    private Python python = new Python();
    private Loop loop = new Loop();
    private Llm llm = new Llm();

    // -- Project accessors (delegate to nested) --
    public Path getProjectRoot() { return Path.of(project.root).toAbsolutePath().normalize(); }

    /** Engine state directory, resolved against the project root when relative. */
    public Path getStateDir() {
        Path dir = Path.of(project.stateDir);
        return dir.isAbsolute() ? dir : getProjectRoot().resolve(dir).normalize();
    }

    public Path getMemoryFile() { return getStateDir().resolve("memory.json"); }
    public Path getEvolutionLogFile() { return getStateDir().resolve("evolution_log.csv"); }

    // -- Process accessors (delegate to nested) --
    public Duration getGitTimeout() { return process.gitTimeout; }
    public Duration getTestTimeout() { return process.testTimeout; }
    public Duration getSyntaxTimeout() { return process.syntaxTimeout; }

    public Project getProject() { return project; }
    public void setProject(Project project) { this.project = project; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }
    public Process getProcess() { return process; }
    public void setProcess(Process process) { this.process = process; }
    public Python getPython() { return python; }
    public void setPython(Python python) { this.python = python; }
    public Loop getLoop() { return loop; }
    public void setLoop(Loop loop) { this.loop = loop; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }

    public static class Project {
        private String root = ".";
        private String stateDir = ".evolver";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
    }

    public static class Engine {
        private int degenerateLoopThreshold = 3;
        private String correctionStrategy = "AUTO_CORRECTION_STRATEGY";
        private boolean generateFollowUps = true;
        private int ledgerSize = 20;
        private int historySize = 20;
        private int correctionDetailsLimit = 2000;
        private int manifestFileLimit = 5;

        public int getDegenerateLoopThreshold() { return degenerateLoopThreshold; }
        public void setDegenerateLoopThreshold(int degenerateLoopThreshold) { this.degenerateLoopThreshold = degenerateLoopThreshold; }
        public String getCorrectionStrategy() { return correctionStrategy; }
        public void setCorrectionStrategy(String correctionStrategy) { this.correctionStrategy = correctionStrategy; }
        public boolean isGenerateFollowUps() { return generateFollowUps; }
        public void setGenerateFollowUps(boolean generateFollowUps) { this.generateFollowUps = generateFollowUps; }
        public int getLedgerSize() { return ledgerSize; }
        public void setLedgerSize(int ledgerSize) { this.ledgerSize = ledgerSize; }
        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
        public int getCorrectionDetailsLimit() { return correctionDetailsLimit; }
        public void setCorrectionDetailsLimit(int correctionDetailsLimit) { this.correctionDetailsLimit = correctionDetailsLimit; }
        public int getManifestFileLimit() { return manifestFileLimit; }
        public void setManifestFileLimit(int manifestFileLimit) { this.manifestFileLimit = manifestFileLimit; }
    }

    public static class Sandbox {
        private String prefix = "evolver_sandbox_";
        private List<String> exclude = new ArrayList<>(List.of(".git", ".evolver"));

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
        public List<String> getExclude() { return exclude; }
        public void setExclude(List<String> exclude) { this.exclude = exclude; }
    }

    public static class Process {
        private Duration gitTimeout = Duration.ofSeconds(60);
        private Duration testTimeout = Duration.ofSeconds(300);
        private Duration syntaxTimeout = Duration.ofSeconds(30);

        public Duration getGitTimeout() { return gitTimeout; }
        public void setGitTimeout(Duration gitTimeout) { this.gitTimeout = gitTimeout; }
        public Duration getTestTimeout() { return testTimeout; }
        public void setTestTimeout(Duration testTimeout) { this.testTimeout = testTimeout; }
        public Duration getSyntaxTimeout() { return syntaxTimeout; }
        public void setSyntaxTimeout(Duration syntaxTimeout) { this.syntaxTimeout = syntaxTimeout; }
    }

    public static class Python {
        private String executable = "python3";
        private String testDir = "tests/";

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public String getTestDir() { return testDir; }
        public void setTestDir(String testDir) { this.testDir = testDir; }
    }

    public static class Loop {
        private boolean continuous = false;
        private int maxCycles = 0;
        private Duration continuousDelay = Duration.ofSeconds(5);
        private Duration cycleDelay = Duration.ZERO;
        private boolean generateInitialObjective = true;

        public boolean isContinuous() { return continuous; }
        public void setContinuous(boolean continuous) { this.continuous = continuous; }
        /** Zero or negative means unlimited. */
        public int getMaxCycles() { return maxCycles; }
        public void setMaxCycles(int maxCycles) { this.maxCycles = maxCycles; }
        public Duration getContinuousDelay() { return continuousDelay; }
        public void setContinuousDelay(Duration continuousDelay) { this.continuousDelay = continuousDelay; }
        public Duration getCycleDelay() { return cycleDelay; }
        public void setCycleDelay(Duration cycleDelay) { this.cycleDelay = cycleDelay; }
        public boolean isGenerateInitialObjective() { return generateInitialObjective; }
        public void setGenerateInitialObjective(boolean generateInitialObjective) { this.generateInitialObjective = generateInitialObjective; }
    }

    public static class Llm {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
