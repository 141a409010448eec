package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.SlideImageClient;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutor;
import com.coursecast.orchestrator.stage.StageResult;
import com.coursecast.orchestrator.timeline.Timeline;
import com.coursecast.orchestrator.timeline.TimelineSegment;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** images: one slide image per timeline segment, plus a segment_id to image manifest. */
@Component
public class ImagesStageExecutor implements StageExecutor {

    private final PipelineArtifacts artifacts;
    private final SlideImageClient  imageClient;

    public ImagesStageExecutor(PipelineArtifacts artifacts, SlideImageClient imageClient) {
        this.artifacts   = artifacts;
        this.imageClient = imageClient;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.IMAGES;
    }

    @Override
    public StageResult execute(StageContext ctx) {
        Timeline timeline = artifacts.readTimeline(ctx.job());
        Map<String, String> manifest = new LinkedHashMap<>();

        int done = 0;
        for (TimelineSegment segment : timeline.segments()) {
            byte[] image;
            try {
                image = imageClient.generateSlideImage(segment.slide().title(), segment.slide().visualPrompt());
            } catch (CollaboratorException e) {
                throw new StageException(
                        e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.EXTERNAL_SERVICE,
                        "Image for " + segment.segmentId() + ": " + e.getMessage(), e);
            }
            if (image == null || image.length == 0) {
                throw new StageException(StageException.Kind.EXTERNAL_SERVICE,
                        "Image for " + segment.segmentId() + " is empty");
            }
            manifest.put(segment.segmentId(),
                    artifacts.store().put(ctx.jobId(), ArtifactKind.SLIDE_IMAGE, segment.segmentId(), image));
            ctx.progress().report(++done * 100 / timeline.segments().size());
        }

        PipelineArtifacts.requireExactSegments("Image manifest", manifest.keySet(), timeline);
        return StageResult.of(artifacts.writeJson(ctx.jobId(), ArtifactKind.IMAGE_MANIFEST, manifest));
    }
}
