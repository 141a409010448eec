package com.coursecast.orchestrator.artifact;

/**
 * Thrown when the storage backend cannot read or write an artifact.
 * Unchecked: stage executors classify it as a transient failure.
 */
public class ArtifactStoreException extends RuntimeException {

    public ArtifactStoreException(String message) {
        super(message);
    }

    public ArtifactStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
