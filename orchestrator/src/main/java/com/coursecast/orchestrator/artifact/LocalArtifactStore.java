package com.coursecast.orchestrator.artifact;

import com.coursecast.orchestrator.config.CourseCastProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * {@link ArtifactStore} on the local filesystem under coursecast.storage.base-path.
 *
 * Each write goes to a temp file in the target directory and is then moved
 * over the final name, so a reader sees either the old bytes or the new ones.
 */
@Component
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final Path root;

    @Autowired
    public LocalArtifactStore(CourseCastProperties props) {
        this(Path.of(props.storage().basePath()));
    }

    public LocalArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot create storage root " + this.root, e);
        }
    }

    @Override
    public String put(UUID jobId, ArtifactKind kind, byte[] content) {
        if (kind.isPerSegment()) {
            throw new IllegalArgumentException(kind + " is stored per segment");
        }
        return write(refFor(jobId, kind), content);
    }

    @Override
    public String put(UUID jobId, ArtifactKind kind, String segmentId, byte[] content) {
        if (!kind.isPerSegment()) {
            throw new IllegalArgumentException(kind + " is not stored per segment");
        }
        if (segmentId == null || !SAFE_SEGMENT.matcher(segmentId).matches()) {
            throw new IllegalArgumentException("Illegal segment id: " + segmentId);
        }
        String ref = jobId + "/" + kind.stem() + "/" + segmentId + "." + kind.extension();
        return write(ref, content);
    }

    @Override
    public byte[] get(String ref) {
        try {
            return Files.readAllBytes(resolve(ref));
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot read artifact " + ref, e);
        }
    }

    @Override
    public InputStream open(String ref) {
        try {
            return Files.newInputStream(resolve(ref));
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot open artifact " + ref, e);
        }
    }

    @Override
    public boolean exists(String ref) {
        return ref != null && Files.isRegularFile(resolve(ref));
    }

    @Override
    public Path resolve(String ref) {
        Path path = root.resolve(ref).normalize();
        if (!path.startsWith(root)) {
            throw new ArtifactStoreException("Artifact reference escapes storage root: " + ref);
        }
        return path;
    }

    @Override
    public String refFor(UUID jobId, ArtifactKind kind) {
        return jobId + "/" + kind.stem() + "." + kind.extension();
    }

    private String write(String ref, byte[] content) {
        Path target = resolve(ref);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".tmp-", "." + target.getFileName());
            try {
                Files.write(tmp, content);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot write artifact " + ref, e);
        }
        log.debug("Wrote artifact {} ({} bytes)", ref, content.length);
        return ref;
    }
}
