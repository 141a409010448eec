package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Durable record of job state, keyed by job ID.
 *
 * {@link #update} is the single concurrency-control point of the pipeline:
 * the orchestrator, operator actions and the recovery sweep all mutate jobs
 * through it, and every change made by one mutation becomes visible at once
 * or not at all.
 */
public interface JobStore {

    Job create(Job job);

    /** @throws JobNotFoundException for an unknown ID */
    Job get(UUID id);

    /**
     * Compare-and-swap update.
     *
     * Applies {@code mutation} only if the stored status/stage still equal
     * {@code expected}, and returns the job as written.
     *
     * @throws JobConflictException if the stored record has moved on
     * @throws JobNotFoundException for an unknown ID
     */
    Job update(UUID id, ExpectedState expected, Consumer<Job> mutation);

    /** @param status optional filter; null lists every job */
    JobPage list(JobStatus status, int page, int pageSize);

    /** PENDING / PROCESSING jobs last written before {@code cutoff}. */
    List<Job> findInFlight(Instant cutoff);
}
