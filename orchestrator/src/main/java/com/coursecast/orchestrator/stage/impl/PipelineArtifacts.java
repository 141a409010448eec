package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.artifact.ArtifactStore;
import com.coursecast.orchestrator.client.ExtractedDocument;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.timeline.Timeline;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reads and writes the JSON artifacts the stages hand to each other:
 * extracted text, the timeline and the per-segment manifests.
 */
@Component
public class PipelineArtifacts {

    private static final TypeReference<LinkedHashMap<String, String>> IMAGE_MANIFEST = new TypeReference<>() {};
    private static final TypeReference<LinkedHashMap<String, AudioClip>> AUDIO_MANIFEST = new TypeReference<>() {};

    private final ArtifactStore store;
    private final ObjectMapper  json;

    public PipelineArtifacts(ArtifactStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.json  = objectMapper;
    }

    public ArtifactStore store() {
        return store;
    }

    public ExtractedDocument readExtractedText(Job job) {
        return read(require(job.getExtractedTextPath(), "extracted text", job), ExtractedDocument.class);
    }

    public Timeline readTimeline(Job job) {
        return read(require(job.getTimelinePath(), "timeline", job), Timeline.class);
    }

    public Map<String, String> readImageManifest(Job job) {
        return read(require(job.getImagesPath(), "image manifest", job), IMAGE_MANIFEST);
    }

    public Map<String, AudioClip> readAudioManifest(Job job) {
        return read(require(job.getAudioPath(), "audio manifest", job), AUDIO_MANIFEST);
    }

    public String writeJson(UUID jobId, ArtifactKind kind, Object value) {
        try {
            return store.put(jobId, kind, json.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize " + kind, e);
        }
    }

    /**
     * Fail with VALIDATION unless {@code ids} names exactly the timeline's
     * segments: none missing, none extra.
     */
    public static void requireExactSegments(String what, Collection<String> ids, Timeline timeline) {
        Set<String> expected = new LinkedHashSet<>(timeline.segmentIds());
        Set<String> actual   = new LinkedHashSet<>(ids);

        Set<String> missing = new LinkedHashSet<>(expected);
        missing.removeAll(actual);
        Set<String> extra = new LinkedHashSet<>(actual);
        extra.removeAll(expected);

        if (!missing.isEmpty() || !extra.isEmpty() || ids.size() != actual.size()) {
            throw new StageException(StageException.Kind.VALIDATION,
                    what + " does not match the timeline segments: missing " + List.copyOf(missing)
                            + ", unexpected " + List.copyOf(extra));
        }
    }

    private static String require(String ref, String name, Job job) {
        if (ref == null) {
            throw new IllegalStateException("Job " + job.getId() + " has no " + name + " yet");
        }
        return ref;
    }

    private <T> T read(String ref, Class<T> type) {
        try {
            return json.readValue(store.get(ref), type);
        } catch (IOException e) {
            throw unreadable(ref, e);
        }
    }

    private <T> T read(String ref, TypeReference<T> type) {
        try {
            return json.readValue(store.get(ref), type);
        } catch (IOException e) {
            throw unreadable(ref, e);
        }
    }

    private static StageException unreadable(String ref, IOException e) {
        return new StageException(StageException.Kind.VALIDATION,
                "Stored artifact " + ref + " is unreadable: " + e.getMessage(), e);
    }
}
