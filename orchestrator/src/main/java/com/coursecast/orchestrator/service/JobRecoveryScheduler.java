package com.coursecast.orchestrator.service;

import com.coursecast.orchestrator.config.CourseCastProperties;
import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Picks up jobs nobody is driving any more.
 *
 * A job left pending/processing by a crashed process (or dropped by a full
 * worker pool) stops being written. Once its updated_at is older than
 * coursecast.pipeline.stall-after it is enqueued again; the orchestrator
 * then re-runs its current stage from scratch.
 *
 * Runs once when the application is ready and then every
 * coursecast.pipeline.recovery-interval.
 */
@Component
@EnableScheduling
public class JobRecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobRecoveryScheduler.class);

    private final JobStore      jobStore;
    private final JobDispatcher dispatcher;
    private final Duration      stallAfter;

    public JobRecoveryScheduler(JobStore jobStore, JobDispatcher dispatcher, CourseCastProperties props) {
        this.jobStore   = jobStore;
        this.dispatcher = dispatcher;
        this.stallAfter = props.pipeline().stallAfter();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        int n = recoverStalledJobs();
        if (n > 0) {
            log.info("Startup recovery re-enqueued {} job(s)", n);
        }
    }

    @Scheduled(fixedDelayString = "${coursecast.pipeline.recovery-interval:PT60S}",
               initialDelayString = "${coursecast.pipeline.recovery-interval:PT60S}")
    public void sweep() {
        recoverStalledJobs();
    }

    /** @return how many jobs were re-enqueued */
    public int recoverStalledJobs() {
        Instant cutoff = Instant.now().minus(stallAfter);
        List<Job> stalled = jobStore.findInFlight(cutoff);
        int recovered = 0;
        for (Job job : stalled) {
            if (dispatcher.isRunning(job.getId())) {
                continue;
            }
            log.warn("Recovering stalled job {} ({}{}, last update {})",
                    job.getId(), job.getStatus().value(),
                    job.getCurrentStage() != null ? "/" + job.getCurrentStage().value() : "",
                    job.getUpdatedAt());
            dispatcher.enqueue(job.getId());
            recovered++;
        }
        return recovered;
    }
}
