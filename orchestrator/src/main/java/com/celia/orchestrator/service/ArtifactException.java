package com.celia.orchestrator.service;

/**
 * Filesystem failure while writing, resolving or deleting job artifacts.
 */
public class ArtifactException extends RuntimeException {

    public ArtifactException(String message, Throwable cause) {
        super(message, cause);
    }
}
