package com.evolver.sandbox;

/**
 * Thrown when a sandbox directory cannot be created or populated.
 */
public class SandboxException extends IllegalStateException {

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
