package com.evolver.sandbox;

import com.evolver.core.config.EvolverProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Creates and destroys isolated copies of the project tree.
 *
 * <p>A sandbox is a fresh temporary directory holding a copy of the project minus
 * version-control metadata and the engine's own state. Steps write into it freely;
 * nothing reaches the real tree until {@link PromotionManager} copies it back.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final String prefix;
    private final ProtectedPaths excluded;

    @Autowired
    public SandboxManager(EvolverProperties properties) {
        this(properties.getSandbox().getPrefix(), ProtectedPaths.from(properties));
    }

    SandboxManager(String prefix, Set<String> excludedNames) {
        this(prefix, new ProtectedPaths(excludedNames));
    }

    SandboxManager(String prefix, ProtectedPaths excluded) {
        this.prefix = prefix;
        this.excluded = excluded;
    }

    /**
     * Copies {@code projectRoot} into a new temporary directory.
     *
     * @throws SandboxException when the directory cannot be created or filled
     */
    public SandboxHandle acquire(Path projectRoot) {
        Path sandbox;
        try {
            sandbox = Files.createTempDirectory(prefix);
        } catch (IOException e) {
            throw new SandboxException("Cannot create sandbox directory", e);
        }

        try {
            copyTree(projectRoot.toAbsolutePath().normalize(), sandbox);
        } catch (IOException e) {
            delete(sandbox);
            throw new SandboxException("Cannot copy project into sandbox " + sandbox, e);
        }
        log.info("Sandbox created at {}", sandbox);
        return new SandboxHandle(sandbox, this);
    }

    public void release(SandboxHandle handle) {
        handle.close();
    }

    private void copyTree(Path source, Path target) throws IOException {
        Files.walkFileTree(source, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(source) && excluded.isProtectedName(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (excluded.isProtectedName(file.getFileName().toString())) {
                    return FileVisitResult.CONTINUE;
                }
                Files.copy(file, target.resolve(source.relativize(file).toString()),
                        StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /** Deletes a sandbox tree. Failures are logged, never thrown. */
    void delete(Path root) {
        if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Could not delete sandbox entry {}: {}", path, e.getMessage());
                }
            });
            log.info("Sandbox {} removed", root);
        } catch (IOException e) {
            log.warn("Could not clean up sandbox {}: {}", root, e.getMessage());
        }
    }
}
