package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.SpeechSynthesisClient;
import com.coursecast.orchestrator.client.SynthesizedAudio;
import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutor;
import com.coursecast.orchestrator.stage.StageResult;
import com.coursecast.orchestrator.timeline.Timeline;
import com.coursecast.orchestrator.timeline.TimelineSegment;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * tts: one narration clip per segment.
 *
 * The timeline's duration_seconds is authoritative. A clip that plays longer
 * than its segment (beyond the overrun tolerance) fails the stage rather
 * than stretching the video.
 */
@Component
public class TtsStageExecutor implements StageExecutor {

    private final PipelineArtifacts     artifacts;
    private final SpeechSynthesisClient speechClient;
    private final double                overrunTolerance;

    @Autowired
    public TtsStageExecutor(PipelineArtifacts artifacts, SpeechSynthesisClient speechClient,
                            CourseCastProperties props) {
        this(artifacts, speechClient, props.tts().overrunToleranceSeconds());
    }

    public TtsStageExecutor(PipelineArtifacts artifacts, SpeechSynthesisClient speechClient,
                            double overrunToleranceSeconds) {
        this.artifacts        = artifacts;
        this.speechClient     = speechClient;
        this.overrunTolerance = overrunToleranceSeconds;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.TTS;
    }

    @Override
    public StageResult execute(StageContext ctx) {
        Timeline timeline = artifacts.readTimeline(ctx.job());
        Map<String, AudioClip> manifest = new LinkedHashMap<>();

        int done = 0;
        for (TimelineSegment segment : timeline.segments()) {
            SynthesizedAudio audio;
            try {
                audio = speechClient.synthesize(segment.narrationText());
            } catch (CollaboratorException e) {
                throw new StageException(
                        e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.EXTERNAL_SERVICE,
                        "Narration for " + segment.segmentId() + ": " + e.getMessage(), e);
            }
            if (audio.durationSeconds() > segment.durationSeconds() + overrunTolerance) {
                throw new StageException(StageException.Kind.VALIDATION,
                        "Narration for %s runs %.2fs but the segment is %.2fs".formatted(
                                segment.segmentId(), audio.durationSeconds(), segment.durationSeconds()));
            }
            String ref = artifacts.store().put(
                    ctx.jobId(), ArtifactKind.NARRATION_AUDIO, segment.segmentId(), audio.audio());
            manifest.put(segment.segmentId(), new AudioClip(ref, audio.durationSeconds()));
            ctx.progress().report(++done * 100 / timeline.segments().size());
        }

        PipelineArtifacts.requireExactSegments("Audio manifest", manifest.keySet(), timeline);
        return StageResult.of(artifacts.writeJson(ctx.jobId(), ArtifactKind.AUDIO_MANIFEST, manifest));
    }
}
