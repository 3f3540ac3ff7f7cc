package com.evolver.sandbox;

import com.evolver.core.config.EvolverProperties;
import com.evolver.core.model.PatchInstruction;
import com.evolver.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Copies validated sandbox files over the real tree, file by file.
 */
@Service
public class PromotionManager {

    private static final Logger log = LoggerFactory.getLogger(PromotionManager.class);

    public static final String APPLIED_AND_VALIDATED_SANDBOX = "APPLIED_AND_VALIDATED_SANDBOX";
    public static final String PROMOTION_FAILED = "PROMOTION_FAILED";

    private final ProtectedPaths protectedPaths;

    public PromotionManager() {
        this(ProtectedPaths.defaults());
    }

    @Autowired
    public PromotionManager(EvolverProperties properties) {
        this(ProtectedPaths.from(properties));
    }

    public PromotionManager(ProtectedPaths protectedPaths) {
        this.protectedPaths = protectedPaths;
    }

    /**
     * For each distinct patched path: copy it from the sandbox, or delete it from the
     * real tree when the sandbox no longer has it. Paths outside the project or inside a
     * protected directory fail the whole promotion before anything is touched.
     */
    public PromotionReport promote(Path sandboxRoot, Path projectRoot, List<PatchInstruction> patches) {
        var files = new LinkedHashSet<String>();
        for (var patch : patches) {
            if (patch.filePath() != null && !patch.filePath().isBlank()) {
                files.add(patch.filePath());
            }
        }

        Optional<String> refused = refusedPath(projectRoot, files);
        if (refused.isPresent()) {
            log.error("Refusing to promote {}", refused.get());
            return new PromotionReport(
                    ValidationResult.failure(PROMOTION_FAILED, "Refusing to promote " + refused.get()),
                    List.of(), List.of());
        }

        var created = new ArrayList<String>();
        var createdDirectories = new ArrayList<String>();
        int copied = 0;
        int deleted = 0;
        for (String file : files) {
            Path source = sandboxRoot.resolve(file).normalize();
            Path target = projectRoot.resolve(file).normalize();
            try {
                if (Files.exists(source)) {
                    if (!Files.exists(target)) {
                        created.add(file);
                    }
                    Path parent = target.getParent();
                    if (parent != null) {
                        createParents(projectRoot, parent, createdDirectories);
                    }
                    Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
                    copied++;
                    log.debug("Promoted {}", file);
                } else if (Files.exists(target)) {
                    Files.delete(target);
                    deleted++;
                    log.debug("Deleted {} (removed in sandbox)", file);
                }
            } catch (IOException e) {
                log.error("Promotion of {} failed", file, e);
                return new PromotionReport(
                        ValidationResult.failure(PROMOTION_FAILED, "Could not promote %s: %s".formatted(file, e.getMessage())),
                        created, deepestFirst(createdDirectories));
            }
        }

        log.info("Promoted {} file(s), deleted {} from the project", copied, deleted);
        return new PromotionReport(
                ValidationResult.success(APPLIED_AND_VALIDATED_SANDBOX,
                        "Synchronized %d file(s) (%d copied, %d deleted)".formatted(copied + deleted, copied, deleted)),
                created, deepestFirst(createdDirectories));
    }

    private Optional<String> refusedPath(Path projectRoot, Iterable<String> files) {
        Path root = projectRoot.toAbsolutePath().normalize();
        for (String file : files) {
            Path target = root.resolve(file).normalize();
            if (!target.startsWith(root) || target.equals(root)) {
                return Optional.of(file + " (outside the project)");
            }
            Optional<String> reserved = protectedPaths.protectedSegment(root.relativize(target));
            if (reserved.isPresent()) {
                return Optional.of(file + " (inside protected " + reserved.get() + ")");
            }
        }
        return Optional.empty();
    }

    /** Creates missing parent directories, remembering each new one relative to the project root. */
    private static void createParents(Path projectRoot, Path parent, List<String> createdDirectories) throws IOException {
        var missing = new ArrayList<Path>();
        for (Path dir = parent; dir != null && !Files.exists(dir); dir = dir.getParent()) {
            missing.add(dir);
        }
        Files.createDirectories(parent);
        Path root = projectRoot.normalize();
        for (Path dir : missing) {
            createdDirectories.add(root.relativize(dir.normalize()).toString());
        }
    }

    private static List<String> deepestFirst(List<String> directories) {
        var sorted = new ArrayList<>(directories);
        sorted.sort(Collections.reverseOrder());
        return sorted;
    }
}
