package com.coursecast.orchestrator.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The five pipeline stages, in their fixed execution order.
 *
 * Declaration order IS the pipeline order: a job only moves on to
 * the next constant once the previous stage's artifact is recorded.
 */
public enum PipelineStage {
    EXTRACT,    // PDF text extraction
    GENERATE,   // content + timeline generation
    IMAGES,     // one slide image per segment
    TTS,        // one narration clip per segment
    RENDER;     // final video from the rendering service

    public Optional<PipelineStage> next() {
        PipelineStage[] all = values();
        int idx = ordinal() + 1;
        return idx < all.length ? Optional.of(all[idx]) : Optional.empty();
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PipelineStage fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
