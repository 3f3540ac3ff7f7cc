package com.evolver.sandbox;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one ephemeral copy of the project tree. Closing the handle deletes the copy;
 * closing twice is a no-op.
 */
public final class SandboxHandle implements AutoCloseable {

    private final Path root;
    private final SandboxManager manager;
    private final AtomicBoolean released = new AtomicBoolean(false);

    SandboxHandle(Path root, SandboxManager manager) {
        this.root = root;
        this.manager = manager;
    }

    public Path root() {
        return root;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.delete(root);
        }
    }
}
