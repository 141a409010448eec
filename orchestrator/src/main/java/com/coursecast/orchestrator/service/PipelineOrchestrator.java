package com.coursecast.orchestrator.service;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.model.FailureKind;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.model.PipelineStage;
import com.coursecast.orchestrator.repository.ExpectedState;
import com.coursecast.orchestrator.repository.JobConflictException;
import com.coursecast.orchestrator.repository.JobStore;
import com.coursecast.orchestrator.stage.ProgressReporter;
import com.coursecast.orchestrator.stage.StageContext;
import com.coursecast.orchestrator.stage.StageException;
import com.coursecast.orchestrator.stage.StageExecutorRegistry;
import com.coursecast.orchestrator.stage.StageResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The job state machine.
 *
 * {@link #advance} performs exactly one transition for a job and persists
 * it through {@link JobStore#update}, so any number of invocations (threads,
 * processes, a restart halfway through a stage) can race on the same job
 * and only one of them wins each step.
 *
 * <pre>
 *   pending ─▶ processing(extract) ─▶ … ─▶ processing(render) ─▶ completed
 *                  │                           │
 *                  └──────── failed / cancelled ┘
 * </pre>
 *
 * The stage to run is always the first one whose artifact reference is
 * still empty. A crash mid-stage therefore re-runs that stage from scratch;
 * a crash after the artifact is recorded never repeats it.
 *
 * Timing of retries is not decided here: a retryable failure is recorded
 * and reported as {@link Outcome#RETRY_SCHEDULED}, and the caller
 * ({@link JobDispatcher}) decides when to call again.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    public enum Outcome {
        /** A stage finished and the job moved to the next one. */
        ADVANCED,
        COMPLETED,
        RETRY_SCHEDULED,
        FAILED,
        CANCELLED,
        /** The job was already terminal. */
        NO_OP,
        /** Another invocation changed the job first; this one stopped. */
        CONFLICT
    }

    private final JobStore              jobStore;
    private final StageExecutorRegistry executors;
    private final MeterRegistry         meterRegistry;
    private final int                   maxStageRetries;

    public PipelineOrchestrator(JobStore jobStore,
                                StageExecutorRegistry executors,
                                MeterRegistry meterRegistry,
                                CourseCastProperties props) {
        this.jobStore        = jobStore;
        this.executors       = executors;
        this.meterRegistry   = meterRegistry;
        this.maxStageRetries = props.pipeline().maxStageRetries();
    }

    public Outcome advance(UUID jobId) {
        MDC.put("jobId", jobId.toString());
        try {
            return doAdvance(jobId);
        } catch (JobConflictException e) {
            log.info("{}; stopping this invocation", e.getMessage());
            return Outcome.CONFLICT;
        } finally {
            MDC.remove("stage");
            MDC.remove("jobId");
        }
    }

    private Outcome doAdvance(UUID jobId) {
        Job job = jobStore.get(jobId);

        if (job.getStatus().isTerminal()) {
            log.debug("Job {} is already {}; nothing to do", jobId, job.getStatus().value());
            return Outcome.NO_OP;
        }

        if (job.isCancelRequested()) {
            jobStore.update(jobId, ExpectedState.of(job), Job::markCancelled);
            countTransition(JobStatus.CANCELLED.value());
            log.info("Job {} cancelled", jobId);
            return Outcome.CANCELLED;
        }

        Optional<PipelineStage> next = firstIncompleteStage(job);
        if (next.isEmpty()) {
            // Render's artifact and the completion are written together, so this is a corrupted row.
            return fail(job, PipelineStage.RENDER, FailureKind.INTERNAL,
                    "All stage artifacts are recorded but the job never completed");
        }
        PipelineStage stage = next.get();
        MDC.put("stage", stage.value());

        if (job.getStatus() == JobStatus.PENDING || job.getCurrentStage() != stage) {
            job = jobStore.update(jobId, ExpectedState.of(job), j -> j.markProcessing(stage));
        }
        // Pinned to this attempt: a concurrent invocation that records a retry first wins.
        ExpectedState running = ExpectedState.atAttempt(job);

        log.info("Running stage '{}' (attempt {})", stage.value(), job.getStageRetryCount() + 1);
        StageResult result;
        try {
            result = executors.execute(stage, new StageContext(job, progressReporter(jobId, running)));
        } catch (StageException e) {
            return handleStageFailure(job, stage, running, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in stage '{}': {}", stage.value(), e.getMessage(), e);
            return fail(job, stage, FailureKind.INTERNAL,
                    "Unexpected error in " + stage.value() + ": " + e);
        }

        try {
            jobStore.update(jobId, running, j -> {
                j.recordStageSuccess(stage, result.artifactRef());
                if (stage == PipelineStage.RENDER) {
                    j.markCompleted(result.videoDurationSeconds(), result.slideCount());
                }
            });
        } catch (IllegalStateException e) {
            return fail(job, stage, FailureKind.INTERNAL, e.getMessage());
        }

        if (stage == PipelineStage.RENDER) {
            countTransition(JobStatus.COMPLETED.value());
            log.info("Job {} completed: {} slides, {}s", jobId, result.slideCount(), result.videoDurationSeconds());
            return Outcome.COMPLETED;
        }
        log.info("Stage '{}' done, artifact {}", stage.value(), result.artifactRef());
        return Outcome.ADVANCED;
    }

    private Outcome handleStageFailure(Job job, PipelineStage stage, ExpectedState running, StageException e) {
        AtomicBoolean retried = new AtomicBoolean(false);

        Job written = jobStore.update(job.getId(), running, j -> {
            if (e.retryable() && j.getStageRetryCount() < maxStageRetries) {
                j.recordAutomaticRetry(e.failureKind(), e.getMessage());
                retried.set(true);
            } else {
                j.markFailed(stage, e.failureKind(), e.getMessage());
            }
        });

        if (retried.get()) {
            countTransition("retry");
            log.warn("Stage '{}' failed ({}), retry {}/{}: {}", stage.value(), e.getKind(),
                    written.getStageRetryCount(), maxStageRetries, e.getMessage());
            return Outcome.RETRY_SCHEDULED;
        }
        countTransition(JobStatus.FAILED.value());
        log.error("Job {} failed at stage '{}' ({}): {}", job.getId(), stage.value(), e.getKind(), e.getMessage());
        return Outcome.FAILED;
    }

    private Outcome fail(Job job, PipelineStage stage, FailureKind kind, String message) {
        jobStore.update(job.getId(), ExpectedState.of(job), j -> j.markFailed(stage, kind, message));
        countTransition(JobStatus.FAILED.value());
        log.error("Job {} failed at stage '{}' ({}): {}", job.getId(), stage.value(), kind.value(), message);
        return Outcome.FAILED;
    }

    /**
     * Progress writes are advisory: they go through the same compare-and-swap
     * but a lost race is ignored.
     */
    private ProgressReporter progressReporter(UUID jobId, ExpectedState running) {
        return percent -> {
            try {
                jobStore.update(jobId, running, j -> j.setStageProgress(percent));
            } catch (JobConflictException e) {
                log.debug("Progress update on job {} skipped: {}", jobId, e.getMessage());
            }
        };
    }

    private void countTransition(String to) {
        meterRegistry.counter("coursecast.job.transitions", "to", to).increment();
    }

    static Optional<PipelineStage> firstIncompleteStage(Job job) {
        return Arrays.stream(PipelineStage.values())
                .filter(s -> job.artifactFor(s) == null)
                .findFirst();
    }
}
