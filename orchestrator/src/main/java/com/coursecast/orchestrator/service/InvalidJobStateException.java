package com.coursecast.orchestrator.service;

import java.util.UUID;

/** An operator action that the job's current status does not allow. */
public class InvalidJobStateException extends RuntimeException {

    private final UUID jobId;

    public InvalidJobStateException(UUID jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
