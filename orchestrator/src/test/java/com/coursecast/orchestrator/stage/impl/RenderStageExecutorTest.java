package com.coursecast.orchestrator.stage.impl;

import com.coursecast.orchestrator.TestProperties;
import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.artifact.LocalArtifactStore;
import com.coursecast.orchestrator.client.CollaboratorException;
import com.coursecast.orchestrator.client.RenderClient;
import com.coursecast.orchestrator.client.RenderRequest;
import com.coursecast.orchestrator.client.RenderedVideo;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.stage.ProgressReporter;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageResult;
import com.coursecast.orchestrator.timeline.TimelineFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RenderStageExecutorTest {

    @TempDir Path storageRoot;

    @Mock RenderClient renderClient;

    LocalArtifactStore  store;
    PipelineArtifacts   artifacts;
    RenderStageExecutor executor;
    UUID                jobId;

    @BeforeEach
    void setUp() {
        store     = new LocalArtifactStore(storageRoot);
        artifacts = new PipelineArtifacts(store, new ObjectMapper());
        executor  = new RenderStageExecutor(artifacts, renderClient, TestProperties.create());
        jobId     = UUID.randomUUID();
    }

    @Test
    void render_matchingVideo_returnsVideoRefAndSlideCount() throws Exception {
        Job job = jobReadyToRender("seg_001", "seg_002", "seg_003");
        when(renderClient.render(any())).thenAnswer(inv -> writeVideo(inv.getArgument(0), 15.2));

        StageResult result = executor.execute(new StageContext(job, ProgressReporter.NONE));

        assertThat(result.artifactRef()).isEqualTo(jobId + "/video.mp4");
        assertThat(result.slideCount()).isEqualTo(3);
        assertThat(result.videoDurationSeconds()).isEqualTo(15.2);
    }

    @Test
    void render_sendsSegmentsInTimelineOrderWithAbsolutePaths() throws Exception {
        Job job = jobReadyToRender("seg_001", "seg_002", "seg_003");
        when(renderClient.render(any())).thenAnswer(inv -> writeVideo(inv.getArgument(0), 15.0));

        executor.execute(new StageContext(job, ProgressReporter.NONE));

        ArgumentCaptor<RenderRequest> captor = ArgumentCaptor.forClass(RenderRequest.class);
        verify(renderClient).render(captor.capture());
        RenderRequest request = captor.getValue();
        assertThat(request.totalDurationSeconds()).isEqualTo(15.0);
        assertThat(request.fps()).isEqualTo(30);
        assertThat(request.segments()).extracting(RenderRequest.Segment::segmentId)
                .containsExactly("seg_001", "seg_002", "seg_003");
        assertThat(request.segments()).extracting(RenderRequest.Segment::startTimeSeconds)
                .containsExactly(0.0, 5.0, 10.0);
        assertThat(Path.of(request.segments().get(0).imagePath())).isAbsolute().exists();
        assertThat(Path.of(request.segments().get(2).audioPath())).isAbsolute().exists();
        assertThat(request.outputPath()).isEqualTo(store.resolve(jobId + "/video.mp4").toString());
    }

    @Test
    void render_imageManifestMissingSegment_failsValidationWithoutCallingRenderer() {
        Job job = jobReadyToRender("seg_001", "seg_002");

        assertThatThrownBy(() -> executor.execute(new StageContext(job, ProgressReporter.NONE)))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StageException.Kind.VALIDATION))
                .hasMessageContaining("Image manifest")
                .hasMessageContaining("seg_003");
        verify(renderClient, never()).render(any());
    }

    @Test
    void render_durationOffTimeline_failsValidation() throws Exception {
        Job job = jobReadyToRender("seg_001", "seg_002", "seg_003");
        when(renderClient.render(any())).thenAnswer(inv -> writeVideo(inv.getArgument(0), 18.0));

        assertThatThrownBy(() -> executor.execute(new StageContext(job, ProgressReporter.NONE)))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StageException.Kind.VALIDATION))
                .hasMessageContaining("18.00s");
    }

    @Test
    void render_successWithoutVideoFile_failsAsExternalService() {
        Job job = jobReadyToRender("seg_001", "seg_002", "seg_003");
        when(renderClient.render(any())).thenReturn(new RenderedVideo("/nowhere.mp4", 15.0));

        assertThatThrownBy(() -> executor.execute(new StageContext(job, ProgressReporter.NONE)))
                .isInstanceOfSatisfying(StageException.class,
                        e -> assertThat(e.getKind()).isEqualTo(StageException.Kind.EXTERNAL_SERVICE));
    }

    @Test
    void render_rendererUnavailable_isTransient() {
        Job job = jobReadyToRender("seg_001", "seg_002", "seg_003");
        when(renderClient.render(any())).thenThrow(new CollaboratorException("Renderer returned HTTP 503", true));

        assertThatThrownBy(() -> executor.execute(new StageContext(job, ProgressReporter.NONE)))
                .isInstanceOfSatisfying(StageException.class, e -> assertThat(e.retryable()).isTrue());
    }

    /** A job whose timeline is 3 x 5s and whose image manifest covers only {@code imageSegments}. */
    private Job jobReadyToRender(String... imageSegments) {
        Job job = new Job(jobId, "fractions.pdf", jobId + "/source.pdf");
        job.markProcessing(PipelineStage.EXTRACT);
        job.recordStageSuccess(PipelineStage.EXTRACT, jobId + "/extracted.json");
        job.recordStageSuccess(PipelineStage.GENERATE,
                artifacts.writeJson(jobId, ArtifactKind.TIMELINE, TimelineFixtures.timeline(5, 5, 5)));

        Map<String, String> images = new LinkedHashMap<>();
        for (String seg : imageSegments) {
            images.put(seg, store.put(jobId, ArtifactKind.SLIDE_IMAGE, seg, new byte[] {1, 2, 3}));
        }
        job.recordStageSuccess(PipelineStage.IMAGES, artifacts.writeJson(jobId, ArtifactKind.IMAGE_MANIFEST, images));

        Map<String, AudioClip> audio = new LinkedHashMap<>();
        for (String seg : new String[] {"seg_001", "seg_002", "seg_003"}) {
            audio.put(seg, new AudioClip(store.put(jobId, ArtifactKind.NARRATION_AUDIO, seg, new byte[] {4}), 4.5));
        }
        job.recordStageSuccess(PipelineStage.TTS, artifacts.writeJson(jobId, ArtifactKind.AUDIO_MANIFEST, audio));
        return job;
    }

    private static RenderedVideo writeVideo(RenderRequest request, double seconds) throws Exception {
        Path out = Path.of(request.outputPath());
        Files.createDirectories(out.getParent());
        Files.write(out, new byte[] {0, 0, 0, 24});
        return new RenderedVideo(request.outputPath(), seconds);
    }
}
