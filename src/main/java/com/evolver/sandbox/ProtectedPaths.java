package com.evolver.sandbox;

import com.evolver.core.config.EvolverProperties;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * File and directory names that never enter a sandbox: version-control metadata and the
 * engine's own state. A sandbox cannot show their real contents, so patches and promotions
 * must not reach into them either.
 */
public final class ProtectedPaths {

    public static final Set<String> DEFAULT_NAMES = Set.of(".git", ".evolver");

    private final Set<String> names;

    public ProtectedPaths(Collection<String> names) {
        this.names = Set.copyOf(names);
    }

    public static ProtectedPaths defaults() {
        return new ProtectedPaths(DEFAULT_NAMES);
    }

    public static ProtectedPaths from(EvolverProperties properties) {
        return new ProtectedPaths(properties.getSandbox().getExclude());
    }

    public boolean isProtectedName(String name) {
        return names.contains(name);
    }

    /**
     * Returns the first protected segment of a path relative to the project root, if any.
     */
    public Optional<String> protectedSegment(Path relative) {
        for (Path segment : relative.normalize()) {
            String name = segment.toString();
            if (names.contains(name)) {
                return Optional.of(name);
            }
        }
        return Optional.empty();
    }
}
