package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.ContentGenerationClient;
import com.coursecast.orchestrator.client.ExtractedDocument;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutor;
import com.coursecast.orchestrator.stage.StageResult;
import com.coursecast.orchestrator.timeline.Timeline;
import com.coursecast.orchestrator.timeline.TimelineValidationException;
import com.coursecast.orchestrator.timeline.TimelineValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * generate: extracted text to the authoritative timeline.
 *
 * The timeline is written only after it passes validation, so a rejected
 * generation leaves no timeline artifact behind.
 */
@Component
public class GenerateStageExecutor implements StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(GenerateStageExecutor.class);

    private final PipelineArtifacts       artifacts;
    private final ContentGenerationClient contentClient;
    private final TimelineValidator       validator;

    public GenerateStageExecutor(PipelineArtifacts artifacts,
                                 ContentGenerationClient contentClient,
                                 TimelineValidator validator) {
        this.artifacts     = artifacts;
        this.contentClient = contentClient;
        this.validator     = validator;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.GENERATE;
    }

    @Override
    public StageResult execute(StageContext ctx) {
        ExtractedDocument document = artifacts.readExtractedText(ctx.job());
        ctx.progress().report(10);

        String raw;
        try {
            raw = contentClient.generateTimeline(document);
        } catch (CollaboratorException e) {
            throw new StageException(
                    e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.EXTERNAL_SERVICE,
                    e.getMessage(), e);
        }
        ctx.progress().report(80);

        Timeline timeline;
        try {
            timeline = validator.parse(raw);
        } catch (TimelineValidationException e) {
            throw new StageException(StageException.Kind.VALIDATION, e.getMessage(), e);
        }

        log.info("Generated timeline '{}': {} segments, {}s",
                timeline.title(), timeline.segments().size(), timeline.totalDurationSeconds());
        return StageResult.of(artifacts.writeJson(ctx.jobId(), ArtifactKind.TIMELINE, timeline));
    }
}
