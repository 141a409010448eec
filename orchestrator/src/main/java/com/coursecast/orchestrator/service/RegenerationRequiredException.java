package com.coursecast.orchestrator.service;

import java.util.UUID;

/**
 * Retry refused: the job failed because its generated timeline was invalid,
 * and the timeline is never regenerated in place. Resubmit the PDF instead.
 */
public class RegenerationRequiredException extends InvalidJobStateException {

    public RegenerationRequiredException(UUID jobId) {
        super(jobId, "Job " + jobId + " failed timeline validation; resubmit the PDF to generate a new timeline");
    }
}
