package com.coursecast.orchestrator.stage;

import com.coursecast.orchestrator.model.Job;

import java.util.UUID;

/**
 * What an executor gets to see: a snapshot of the job as it was when the
 * stage started, and a way to report progress. Executors never write the job.
 */
public record StageContext(Job job, ProgressReporter progress) {

    public UUID jobId() {
        return job.getId();
    }
}
