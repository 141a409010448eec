package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.artifact.ArtifactStore;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.RenderClient;
import com.coursecast.orchestrator.client.RenderRequest;
import com.coursecast.orchestrator.client.RenderedVideo;
import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutor;
import com.coursecast.orchestrator.stage.StageResult;
import com.coursecast.orchestrator.timeline.Timeline;
import com.coursecast.orchestrator.timeline.TimelineSegment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * render: timeline plus per-segment image and audio to the final MP4.
 *
 * Both manifests are checked against the timeline before the renderer is
 * called, and the rendered length against the timeline total afterwards.
 */
@Component
public class RenderStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(RenderStageExecutor.class);

    private final PipelineArtifacts            artifacts;
    private final RenderClient                 renderClient;
    private final CourseCastProperties.Renderer renderer;
    private final double                       tolerance;

    public RenderStageExecutor(PipelineArtifacts artifacts, RenderClient renderClient,
                               CourseCastProperties props) {
        this.artifacts    = artifacts;
        this.renderClient = renderClient;
        this.renderer     = props.renderer();
        this.tolerance    = props.timeline().toleranceSeconds();
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.RENDER;
    }

    @Override
    public StageResult execute(StageContext ctx) {
        Job job = ctx.job();
        Timeline timeline = artifacts.readTimeline(job);
        Map<String, String>    images = artifacts.readImageManifest(job);
        Map<String, AudioClip> audio  = artifacts.readAudioManifest(job);
        PipelineArtifacts.requireExactSegments("Image manifest", images.keySet(), timeline);
        PipelineArtifacts.requireExactSegments("Audio manifest", audio.keySet(), timeline);

        ArtifactStore store = artifacts.store();
        String videoRef = store.refFor(job.getId(), ArtifactKind.VIDEO);

        List<RenderRequest.Segment> segments = timeline.segments().stream()
                .map(s -> toRenderSegment(s, store, images.get(s.segmentId()), audio.get(s.segmentId()).ref()))
                .toList();
        double expected = timeline.segments().stream().mapToDouble(TimelineSegment::durationSeconds).sum();

        RenderRequest request = new RenderRequest(
                job.getId(),
                store.resolve(videoRef).toString(),
                renderer.fps(), renderer.width(), renderer.height(),
                timeline.title(),
                expected,
                segments);
        ctx.progress().report(5);

        RenderedVideo video;
        try {
            video = renderClient.render(request);
        } catch (CollaboratorException e) {
            throw new StageException(
                    e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.EXTERNAL_SERVICE,
                    e.getMessage(), e);
        }

        if (!store.exists(videoRef)) {
            throw new StageException(StageException.Kind.EXTERNAL_SERVICE,
                    "Renderer reported success but " + videoRef + " was not written");
        }
        if (Math.abs(video.durationSeconds() - expected) > tolerance) {
            throw new StageException(StageException.Kind.VALIDATION,
                    "Rendered video is %.2fs but the timeline totals %.2fs".formatted(
                            video.durationSeconds(), expected));
        }
        log.info("Rendered {} ({}s, {} slides)", videoRef, video.durationSeconds(), segments.size());
        return StageResult.rendered(videoRef, segments.size(), video.durationSeconds());
    }

    private static RenderRequest.Segment toRenderSegment(TimelineSegment s, ArtifactStore store,
                                                         String imageRef, String audioRef) {
        return new RenderRequest.Segment(
                s.segmentId(),
                s.startTimeSeconds(),
                s.durationSeconds(),
                s.slide().title(),
                s.slide().bullets(),
                s.narrationText(),
                store.resolve(imageRef).toString(),
                store.resolve(audioRef).toString());
    }
}
