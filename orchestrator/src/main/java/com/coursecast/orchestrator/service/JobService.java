package com.coursecast.orchestrator.service;

import com.coursecast.orchestrator.artifact.ArtifactKind;
import com.coursecast.orchestrator.artifact.ArtifactStore;
import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.model.FailureKind;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.repository.ExpectedState;
import com.coursecast.orchestrator.repository.JobConflictException;
import com.coursecast.orchestrator.repository.JobNotFoundException;
import com.coursecast.orchestrator.repository.JobPage;
import com.coursecast.orchestrator.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.util.Locale;
import java.util.UUID;

/**
 * Job submission, queries and the operator actions (retry, cancel, resubmit).
 *
 * Pipeline progress itself belongs to {@link PipelineOrchestrator}; this
 * class only creates jobs, flips them back into flight, and hands them to
 * the {@link JobDispatcher}.
 */
@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    static final int MAX_PAGE_SIZE = 100;

    // Cancel races the orchestrator moving stages; re-read and try again a few times.
    private static final int CANCEL_ATTEMPTS = 5;

    private final JobStore      jobStore;
    private final ArtifactStore artifactStore;
    private final JobDispatcher dispatcher;
    private final long          maxUploadBytes;

    public JobService(JobStore jobStore,
                      ArtifactStore artifactStore,
                      JobDispatcher dispatcher,
                      CourseCastProperties props) {
        this.jobStore       = jobStore;
        this.artifactStore  = artifactStore;
        this.dispatcher     = dispatcher;
        this.maxUploadBytes = props.upload().maxBytes();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /**
     * Store the PDF, create a pending job and enqueue it.
     * Returns as soon as the job row exists; nothing runs on the caller's thread.
     *
     * @throws InvalidUploadException if the file is not a non-empty PDF within the size limit
     */
    public Job submit(String filename, byte[] content) {
        validateUpload(filename, content);

        UUID id = UUID.randomUUID();
        String pdfRef = artifactStore.put(id, ArtifactKind.SOURCE_PDF, content);
        Job job = jobStore.create(new Job(id, filename, pdfRef));
        log.info("Job {} submitted for '{}' ({} bytes)", id, filename, content.length);

        dispatcher.enqueue(id);
        return job;
    }

    /** A new job for the same PDF. The only way to get a fresh timeline. */
    public Job resubmit(UUID id) {
        Job original = jobStore.get(id);
        byte[] pdf = artifactStore.get(original.getPdfPath());
        Job job = submit(original.getOriginalFilename(), pdf);
        log.info("Job {} resubmitted as {}", id, job.getId());
        return job;
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** @throws JobNotFoundException for an unknown ID */
    public Job get(UUID id) {
        return jobStore.get(id);
    }

    public JobPage list(JobStatus status, int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        return jobStore.list(status, page, pageSize);
    }

    /** @throws InvalidJobStateException unless the job has completed */
    public InputStream openVideo(UUID id) {
        Job job = jobStore.get(id);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new InvalidJobStateException(id,
                    "Video not available: job " + id + " is " + job.getStatus().value());
        }
        return artifactStore.open(job.getVideoPath());
    }

    // ------------------------------------------------------------------
    // Operator actions
    // ------------------------------------------------------------------

    /**
     * Put a failed job back into flight at the stage that failed.
     *
     * @throws InvalidJobStateException       if the job is not failed
     * @throws RegenerationRequiredException  if it failed timeline validation
     */
    public Job retry(UUID id) {
        Job job = jobStore.get(id);
        if (job.getStatus() != JobStatus.FAILED) {
            throw new InvalidJobStateException(id,
                    "Only failed jobs can be retried; job " + id + " is " + job.getStatus().value());
        }
        if (job.getErrorStage() == PipelineStage.GENERATE && job.getErrorKind() == FailureKind.VALIDATION) {
            throw new RegenerationRequiredException(id);
        }

        Job updated;
        try {
            updated = jobStore.update(id, new ExpectedState(JobStatus.FAILED, null), Job::resetForRetry);
        } catch (JobConflictException e) {
            throw new InvalidJobStateException(id, "Job " + id + " changed while retrying; try again");
        }
        log.info("Job {} retried from stage '{}' (retry_count={})", id,
                job.getErrorStage() != null ? job.getErrorStage().value() : "start", updated.getRetryCount());
        dispatcher.enqueue(id);
        return updated;
    }

    /**
     * Ask a pending or processing job to stop. The running stage is not
     * interrupted; the job becomes cancelled at the next stage boundary.
     *
     * @throws InvalidJobStateException if the job is already terminal
     */
    public Job cancel(UUID id) {
        for (int attempt = 1; ; attempt++) {
            Job job = jobStore.get(id);
            if (job.getStatus().isTerminal()) {
                throw new InvalidJobStateException(id,
                        "Job " + id + " is already " + job.getStatus().value());
            }
            try {
                Job updated = jobStore.update(id, ExpectedState.of(job), Job::requestCancel);
                log.info("Cancellation requested for job {} ({})", id, ExpectedState.of(updated));
                dispatcher.enqueue(id);
                return updated;
            } catch (JobConflictException e) {
                if (attempt >= CANCEL_ATTEMPTS) {
                    throw new InvalidJobStateException(id, "Job " + id + " kept changing; cancel again");
                }
                log.debug("Cancel of job {} raced a transition, re-reading: {}", id, e.getMessage());
            }
        }
    }

    private void validateUpload(String filename, byte[] content) {
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new InvalidUploadException("File must be a PDF");
        }
        if (content == null || content.length == 0) {
            throw new InvalidUploadException("Empty file uploaded");
        }
        if (content.length > maxUploadBytes) {
            throw new InvalidUploadException("File too large: " + content.length
                    + " bytes (maximum " + maxUploadBytes + ")");
        }
    }
}
