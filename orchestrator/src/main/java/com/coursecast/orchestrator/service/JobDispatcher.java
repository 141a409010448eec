package com.coursecast.orchestrator.service;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.repository.JobNotFoundException;
import com.coursecast.orchestrator.repository.JobStore;
import com.coursecast.orchestrator.service.PipelineOrchestrator.Outcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Runs jobs on a fixed worker pool.
 *
 * {@link #enqueue} returns immediately; a worker then calls
 * {@link PipelineOrchestrator#advance} until the job stops advancing.
 * A job whose stage failed transiently is handed back to the pool after an
 * exponential backoff with jitter.
 *
 * A job is driven by at most one worker in this process. An enqueue that
 * arrives while the job is running is remembered and replayed when the
 * worker lets go, so an operator retry or cancel is never lost. When the
 * drive ended in a scheduled retry the backoff timer does that replay
 * instead, so the delay is never skipped. Across processes the
 * compare-and-swap in the job store is what keeps drives apart.
 */
@Component
public class JobDispatcher {

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);

    private static final double JITTER = 0.25;

    private final PipelineOrchestrator       orchestrator;
    private final JobStore                   jobStore;
    private final CourseCastProperties.Pipeline config;
    private final ExecutorService            workers;
    private final ScheduledExecutorService   backoffTimer;

    // job id -> "enqueued again while running"
    private final Map<UUID, Boolean> inFlight = new HashMap<>();
    // jobs waiting on the backoff timer; guarded by inFlight
    private final Set<UUID> awaitingRetry = new HashSet<>();

    public JobDispatcher(PipelineOrchestrator orchestrator, JobStore jobStore, CourseCastProperties props) {
        this.orchestrator = orchestrator;
        this.jobStore     = jobStore;
        this.config       = props.pipeline();
        this.workers      = Executors.newFixedThreadPool(config.workerCount());
        this.backoffTimer = Executors.newSingleThreadScheduledExecutor();
    }

    public void enqueue(UUID jobId) {
        synchronized (inFlight) {
            if (inFlight.containsKey(jobId)) {
                inFlight.put(jobId, true);
                log.debug("Job {} already running here; will run again when it finishes", jobId);
                return;
            }
            inFlight.put(jobId, false);
        }
        try {
            workers.submit(() -> drive(jobId));
        } catch (RejectedExecutionException e) {
            release(jobId, false);
            log.warn("Dispatcher is shutting down; job {} not started", jobId);
        }
    }

    /** Whether this process is driving the job or holds it for a backoff retry. */
    public boolean isRunning(UUID jobId) {
        synchronized (inFlight) {
            return inFlight.containsKey(jobId) || awaitingRetry.contains(jobId);
        }
    }

    private void drive(UUID jobId) {
        Outcome outcome = null;
        try {
            do {
                outcome = orchestrator.advance(jobId);
            } while (outcome == Outcome.ADVANCED && !workers.isShutdown());
        } catch (JobNotFoundException e) {
            log.warn("Dropping job {}: {}", jobId, e.getMessage());
        } catch (Exception e) {
            MDC.put("jobId", jobId.toString());
            log.error("Unhandled error driving job {}: {}", jobId, e.getMessage(), e);
            MDC.remove("jobId");
        } finally {
            boolean retry  = outcome == Outcome.RETRY_SCHEDULED;
            boolean replay = release(jobId, retry);
            if (retry) {
                scheduleRetry(jobId);
            } else if (replay) {
                enqueue(jobId);
            }
        }
    }

    /**
     * @param awaitRetry keep the job marked until its backoff timer fires
     * @return whether the job was enqueued again while it was running
     */
    private boolean release(UUID jobId, boolean awaitRetry) {
        synchronized (inFlight) {
            if (awaitRetry) {
                awaitingRetry.add(jobId);
            }
            return Boolean.TRUE.equals(inFlight.remove(jobId));
        }
    }

    private void retryNow(UUID jobId) {
        forgetRetry(jobId);
        enqueue(jobId);
    }

    private void scheduleRetry(UUID jobId) {
        int attempt;
        try {
            attempt = jobStore.get(jobId).getStageRetryCount();
        } catch (JobNotFoundException e) {
            log.warn("Job {} disappeared before its retry was scheduled", jobId);
            forgetRetry(jobId);
            return;
        } catch (RuntimeException e) {
            log.warn("Cannot schedule retry of job {}, leaving it to recovery: {}", jobId, e.getMessage());
            forgetRetry(jobId);
            return;
        }
        Duration delay = backoff(attempt, ThreadLocalRandom.current().nextDouble(-JITTER, JITTER));
        log.info("Retrying job {} in {} ms", jobId, delay.toMillis());
        try {
            backoffTimer.schedule(() -> retryNow(jobId), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatcher is shutting down; retry of job {} left to recovery", jobId);
            forgetRetry(jobId);
        }
    }

    private void forgetRetry(UUID jobId) {
        synchronized (inFlight) {
            awaitingRetry.remove(jobId);
        }
    }

    /**
     * Delay before automatic retry number {@code attempt} (1-based):
     * initial * multiplier^(attempt-1), capped at max, then scaled by (1 + jitter).
     */
    Duration backoff(int attempt, double jitter) {
        double base = config.initialBackoff().toMillis()
                * Math.pow(config.backoffMultiplier(), Math.max(0, attempt - 1));
        double capped = Math.min(base, config.maxBackoff().toMillis());
        return Duration.ofMillis(Math.round(capped * (1 + jitter)));
    }

    @PreDestroy
    public void shutdown() {
        backoffTimer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still busy after 30s; interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
