package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.ExtractedDocument;
import com.coursecast.orchestrator.client.PdfTextExtractor;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutor;
import com.coursecast.orchestrator.stage.StageResult;
import org.springframework.stereotype.Component;

/** extract: source PDF to {@code extracted.json}. A PDF that cannot be read is a validation failure. */
@Component
public class ExtractStageExecutor implements StageExecutor {

    private final PipelineArtifacts artifacts;
    private final PdfTextExtractor  extractor;

    public ExtractStageExecutor(PipelineArtifacts artifacts, PdfTextExtractor extractor) {
        this.artifacts = artifacts;
        this.extractor = extractor;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.EXTRACT;
    }

    @Override
    public StageResult execute(StageContext ctx) {
        Job job = ctx.job();
        byte[] pdf = artifacts.store().get(job.getPdfPath());
        ctx.progress().report(10);

        ExtractedDocument document;
        try {
            document = extractor.extract(pdf, job.getOriginalFilename());
        } catch (CollaboratorException e) {
            throw new StageException(
                    e.isTransient() ? StageException.Kind.TRANSIENT : StageException.Kind.VALIDATION,
                    e.getMessage(), e);
        }
        ctx.progress().report(90);
        return StageResult.of(artifacts.writeJson(job.getId(), ArtifactKind.EXTRACTED_TEXT, document));
    }
}
