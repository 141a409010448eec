package com.coursecast.orchestrator.service;

import com.coursecast.orchestrator.TestProperties;
import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.artifact.ArtifactStore;
import com.coursecast.orchestrator.model.FailureKind;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.repository.ExpectedState;
import com.coursecast.orchestrator.repository.JobConflictException;
import com.coursecast.orchestrator.repository.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JobService.
 *
 * Job store, artifact store and dispatcher are mocked: no Spring context,
 * no database, no worker threads.
 */
@ExtendWith(MockitoExtension.class)
class JobServiceTest {

    @Mock JobStore      jobStore;
    @Mock ArtifactStore artifactStore;
    @Mock JobDispatcher dispatcher;

    JobService service;

    @BeforeEach
    void setUp() {
        service = new JobService(jobStore, artifactStore, dispatcher, TestProperties.create("./storage", 100));
    }

    // ------------------------------------------------------------------
    // submit()
    // ------------------------------------------------------------------

    @Test
    void submit_happyPath_storesPdfCreatesPendingJobAndEnqueues() {
        when(artifactStore.put(any(), eq(ArtifactKind.SOURCE_PDF), any(byte[].class)))
                .thenAnswer(inv -> inv.getArgument(0) + "/source.pdf");
        when(jobStore.create(any())).thenAnswer(inv -> inv.getArgument(0));

        Job job = service.submit("Chapter3.PDF", new byte[]{'%', 'P', 'D', 'F'});

        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getCurrentStage()).isNull();
        assertThat(job.getOriginalFilename()).isEqualTo("Chapter3.PDF");
        assertThat(job.getPdfPath()).isEqualTo(job.getId() + "/source.pdf");
        verify(dispatcher).enqueue(job.getId());
    }

    @Test
    void submit_notPdf_rejectedBeforeAnythingIsStored() {
        assertThatThrownBy(() -> service.submit("notes.docx", new byte[]{1}))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessage("File must be a PDF");
        verifyNoInteractions(artifactStore, jobStore, dispatcher);
    }

    @Test
    void submit_emptyFile_rejected() {
        assertThatThrownBy(() -> service.submit("a.pdf", new byte[0]))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessage("Empty file uploaded");
    }

    @Test
    void submit_overSizeLimit_rejected() {
        assertThatThrownBy(() -> service.submit("a.pdf", new byte[101]))
                .isInstanceOf(InvalidUploadException.class)
                .hasMessageStartingWith("File too large");
        verifyNoInteractions(jobStore);
    }

    @Test
    void resubmit_createsNewJobFromSamePdf() {
        Job original = failedJob(PipelineStage.GENERATE, FailureKind.VALIDATION);
        byte[] pdf = {'%', 'P', 'D', 'F'};
        when(jobStore.get(original.getId())).thenReturn(original);
        when(artifactStore.get(original.getPdfPath())).thenReturn(pdf);
        when(artifactStore.put(any(), eq(ArtifactKind.SOURCE_PDF), eq(pdf))).thenReturn("new/source.pdf");
        when(jobStore.create(any())).thenAnswer(inv -> inv.getArgument(0));

        Job job = service.resubmit(original.getId());

        assertThat(job.getId()).isNotEqualTo(original.getId());
        assertThat(job.getStatus()).isEqualTo(JobStatus.PENDING);
        assertThat(job.getOriginalFilename()).isEqualTo(original.getOriginalFilename());
        verify(dispatcher).enqueue(job.getId());
    }

    // ------------------------------------------------------------------
    // retry()
    // ------------------------------------------------------------------

    @Test
    void retry_failedJob_resumesAtFailedStageAndEnqueues() {
        Job job = failedJob(PipelineStage.TTS, FailureKind.TRANSIENT);
        when(jobStore.get(job.getId())).thenReturn(job);
        applyUpdatesTo(job);

        Job result = service.retry(job.getId());

        assertThat(result.getStatus()).isEqualTo(JobStatus.PROCESSING);
        assertThat(result.getCurrentStage()).isEqualTo(PipelineStage.TTS);
        assertThat(result.getErrorMessage()).isNull();
        assertThat(result.getErrorStage()).isNull();
        assertThat(result.getErrorKind()).isNull();
        assertThat(result.getRetryCount()).isEqualTo(1);
        verify(jobStore).update(eq(job.getId()), eq(new ExpectedState(JobStatus.FAILED, null)), any());
        verify(dispatcher).enqueue(job.getId());
    }

    @Test
    void retry_afterTimelineValidationFailure_requiresRegeneration() {
        Job job = failedJob(PipelineStage.GENERATE, FailureKind.VALIDATION);
        when(jobStore.get(job.getId())).thenReturn(job);

        assertThatThrownBy(() -> service.retry(job.getId()))
                .isInstanceOf(RegenerationRequiredException.class);
        verify(jobStore, never()).update(any(), any(), any());
        verifyNoInteractions(dispatcher);
    }

    @Test
    void retry_generateTransientFailure_allowed() {
        Job job = failedJob(PipelineStage.GENERATE, FailureKind.TRANSIENT);
        when(jobStore.get(job.getId())).thenReturn(job);
        applyUpdatesTo(job);

        assertThat(service.retry(job.getId()).getCurrentStage()).isEqualTo(PipelineStage.GENERATE);
    }

    @Test
    void retry_jobNotFailed_rejected() {
        Job job = newJob();
        job.markProcessing(PipelineStage.IMAGES);
        when(jobStore.get(job.getId())).thenReturn(job);

        assertThatThrownBy(() -> service.retry(job.getId()))
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessageContaining("is processing");
        verifyNoInteractions(dispatcher);
    }

    // ------------------------------------------------------------------
    // cancel()
    // ------------------------------------------------------------------

    @Test
    void cancel_processingJob_setsFlagAndEnqueues() {
        Job job = newJob();
        job.markProcessing(PipelineStage.IMAGES);
        when(jobStore.get(job.getId())).thenReturn(job);
        applyUpdatesTo(job);

        Job result = service.cancel(job.getId());

        assertThat(result.isCancelRequested()).isTrue();
        assertThat(result.getStatus()).isEqualTo(JobStatus.PROCESSING);
        verify(dispatcher).enqueue(job.getId());
    }

    @Test
    void cancel_racesStageTransition_rereadsAndSucceeds() {
        Job before = newJob();
        before.markProcessing(PipelineStage.IMAGES);
        Job after = before.copy();
        after.markProcessing(PipelineStage.TTS);
        when(jobStore.get(before.getId())).thenReturn(before, after);
        when(jobStore.update(eq(before.getId()), eq(ExpectedState.of(before)), any()))
                .thenThrow(new JobConflictException(before.getId(), ExpectedState.of(before), ExpectedState.of(after)));
        when(jobStore.update(eq(before.getId()), eq(ExpectedState.of(after)), any()))
                .thenAnswer(inv -> {
                    inv.<Consumer<Job>>getArgument(2).accept(after);
                    return after;
                });

        Job result = service.cancel(before.getId());

        assertThat(result.isCancelRequested()).isTrue();
        assertThat(result.getCurrentStage()).isEqualTo(PipelineStage.TTS);
    }

    @Test
    void cancel_terminalJob_rejected() {
        Job job = failedJob(PipelineStage.RENDER, FailureKind.EXTERNAL_SERVICE);
        when(jobStore.get(job.getId())).thenReturn(job);

        assertThatThrownBy(() -> service.cancel(job.getId()))
                .isInstanceOf(InvalidJobStateException.class)
                .hasMessageContaining("already failed");
        verify(jobStore, never()).update(any(), any(), any());
    }

    // ------------------------------------------------------------------
    // queries
    // ------------------------------------------------------------------

    @Test
    void openVideo_beforeCompletion_rejected() {
        Job job = newJob();
        when(jobStore.get(job.getId())).thenReturn(job);

        assertThatThrownBy(() -> service.openVideo(job.getId()))
                .isInstanceOf(InvalidJobStateException.class);
        verifyNoInteractions(artifactStore);
    }

    @Test
    void list_pageSizeOutOfRange_rejected() {
        assertThatThrownBy(() -> service.list(null, 1, JobService.MAX_PAGE_SIZE + 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.list(null, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void list_passesFilterThrough() {
        service.list(JobStatus.FAILED, 2, 10);

        ArgumentCaptor<JobStatus> status = ArgumentCaptor.forClass(JobStatus.class);
        verify(jobStore).list(status.capture(), eq(2), eq(10));
        assertThat(status.getValue()).isEqualTo(JobStatus.FAILED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Make jobStore.update run the mutation against {@code job} and return it. */
    private void applyUpdatesTo(Job job) {
        when(jobStore.update(eq(job.getId()), any(), any())).thenAnswer(inv -> {
            inv.<Consumer<Job>>getArgument(2).accept(job);
            return job;
        });
    }

    private static Job newJob() {
        UUID id = UUID.randomUUID();
        return new Job(id, "fractions.pdf", id + "/source.pdf");
    }

    private static Job failedJob(PipelineStage stage, FailureKind kind) {
        Job job = newJob();
        job.markProcessing(stage);
        job.markFailed(stage, kind, stage.value() + " went wrong");
        return job;
    }
}
