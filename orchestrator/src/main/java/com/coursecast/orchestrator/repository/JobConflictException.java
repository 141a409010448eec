package com.coursecast.orchestrator.repository;

import java.util.UUID;

/**
 * Thrown when a compare-and-swap update finds the job has already moved on.
 * The caller lost the race and should abandon what it was doing.
 */
public class JobConflictException extends RuntimeException {

    private final UUID jobId;

    public JobConflictException(UUID jobId, ExpectedState expected, ExpectedState actual) {
        super("Job " + jobId + " expected " + expected + " but was " + actual);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
