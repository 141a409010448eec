package com.coursecast.orchestrator.artifact;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Path-addressed persistence of byte artifacts.
 *
 * References are relative keys of the form {@code {job_id}/{stem}.{ext}}
 * or {@code {job_id}/{stem}/{segment_id}.{ext}}. Writes overwrite in place,
 * so a retried stage supersedes whatever a failed attempt left behind.
 * Nothing is ever deleted by the store.
 */
public interface ArtifactStore {

    String put(UUID jobId, ArtifactKind kind, byte[] content);

    String put(UUID jobId, ArtifactKind kind, String segmentId, byte[] content);

    byte[] get(String ref);

    InputStream open(String ref);

    boolean exists(String ref);

    /** Absolute location, for collaborators that read artifacts directly (the renderer). */
    Path resolve(String ref);

    /** Deterministic reference for an artifact, whether or not it exists yet. */
    String refFor(UUID jobId, ArtifactKind kind);
}
