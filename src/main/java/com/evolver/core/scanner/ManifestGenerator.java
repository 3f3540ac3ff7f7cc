package com.evolver.core.scanner;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.model.ProjectContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Walks the project and renders the Markdown manifest handed to the planner.
 * <p>
 * Common VCS, build-tool and IDE directories (e.g. {@code .git}, {@code node_modules},
 * {@code target}) are excluded, as is the engine's own state directory.
 */
@Service
public class ManifestGenerator {

    /** Directories to skip during the walk. */
    private static final Set<String> IGNORE_DIRS = Set.of(
            ".git", "node_modules", "target", "build", ".idea", ".vscode",
            "__pycache__", ".gradle", "dist", "out", ".mvn", ".next",
            ".evolver", ".pytest_cache", ".venv", "venv"
    );

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(
            ".DS_Store", "Thumbs.db"
    );

    private static final int MAX_INLINED_CHARS = 20_000;

    private final int fileLimit;

    @Autowired
    public ManifestGenerator(EvolverProperties properties) {
        this(properties.getEngine().getManifestFileLimit());
    }

    public ManifestGenerator(int fileLimit) {
        this.fileLimit = fileLimit;
    }

    /**
     * Scans the project root and returns its structure, language and build tool.
     *
     * @throws IOException if the directory walk fails
     */
    public ProjectContext scan(Path projectRoot) throws IOException {
        var fileTree = new ArrayList<String>();
        try (var stream = Files.walk(projectRoot)) {
            stream.filter(p -> !shouldIgnore(projectRoot, p))
                  .filter(Files::isRegularFile)
                  .sorted(Comparator.naturalOrder())
                  .forEach(p -> fileTree.add(projectRoot.relativize(p).toString().replace('\\', '/')));
        }

        String language = "unknown";
        String buildTool = "unknown";
        if (Files.exists(projectRoot.resolve("pom.xml"))) {
            language = "java";
            buildTool = "maven";
        } else if (Files.exists(projectRoot.resolve("build.gradle"))
                || Files.exists(projectRoot.resolve("build.gradle.kts"))) {
            language = "java";
            buildTool = "gradle";
        } else if (Files.exists(projectRoot.resolve("package.json"))) {
            language = "javascript";
            buildTool = "node";
        } else if (Files.exists(projectRoot.resolve("requirements.txt"))
                || Files.exists(projectRoot.resolve("pyproject.toml"))) {
            language = "python";
            buildTool = "pip";
        } else if (Files.exists(projectRoot.resolve("go.mod"))) {
            language = "go";
            buildTool = "go-modules";
        } else if (Files.exists(projectRoot.resolve("Cargo.toml"))) {
            language = "rust";
            buildTool = "cargo";
        }

        String summary = "%s project with %d files".formatted(language, fileTree.size());
        return new ProjectContext(projectRoot.toString(), fileTree, language, buildTool, fileTree.size(), summary);
    }

    /**
     * Renders the manifest: summary header plus the file tree.
     */
    public String generate(Path projectRoot) throws IOException {
        ProjectContext context = scan(projectRoot);
        var sb = new StringBuilder();
        sb.append("# Project Manifest\n\n");
        sb.append("- Language: ").append(context.language()).append('\n');
        sb.append("- Build tool: ").append(context.buildTool()).append('\n');
        sb.append("- Files: ").append(context.fileCount()).append("\n\n");
        sb.append("## File tree\n\n");
        for (String file : context.fileTree()) {
            sb.append("- ").append(file).append('\n');
        }
        return sb.toString();
    }

    /**
     * Inlines up to the configured number of project files whose path appears in the objective text.
     */
    public String fileContext(Path projectRoot, String objective) throws IOException {
        List<String> mentioned = scan(projectRoot).fileTree().stream()
                .filter(objective::contains)
                .limit(fileLimit)
                .toList();
        var sb = new StringBuilder();
        for (String file : mentioned) {
            String content;
            try {
                content = Files.readString(projectRoot.resolve(file), StandardCharsets.UTF_8);
            } catch (MalformedInputException e) {
                // binary file
                continue;
            }
            if (content.length() > MAX_INLINED_CHARS) {
                content = content.substring(0, MAX_INLINED_CHARS) + "\n... (truncated)";
            }
            sb.append("### ").append(file).append("\n```\n").append(content);
            if (!content.endsWith("\n")) {
                sb.append('\n');
            }
            sb.append("```\n\n");
        }
        return sb.toString();
    }

    /**
     * A path is ignored when any of its components is an ignored directory or file name.
     */
    private boolean shouldIgnore(Path root, Path path) {
        for (Path component : root.relativize(path)) {
            String name = component.toString();
            if (IGNORE_DIRS.contains(name)) return true;
            if (IGNORE_FILES.contains(name)) return true;
        }
        return false;
    }
}
