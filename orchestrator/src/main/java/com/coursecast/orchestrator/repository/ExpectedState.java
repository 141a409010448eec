package com.coursecast.orchestrator.repository;

import com.coursecast.orchestrator.model.Job;
import com.coursecast.orchestrator.model.JobStatus;
import com.coursecast.orchestrator.model.PipelineStage;

/**
 * What a caller believes the stored status/stage to be when it asks for an update.
 * A null stage means "no stage", not "any stage".
 *
 * {@code stageAttempt}, when set, must also equal the stored stage_retry_count.
 * An automatic retry leaves status and stage alone, so this is what tells two
 * invocations of the same stage attempt apart. Null means "any attempt".
 */
public record ExpectedState(JobStatus status, PipelineStage stage, Integer stageAttempt) {

    public ExpectedState(JobStatus status, PipelineStage stage) {
        this(status, stage, null);
    }

    public static ExpectedState of(Job job) {
        return new ExpectedState(job.getStatus(), job.getCurrentStage());
    }

    /** The job's status, stage and current stage attempt. */
    public static ExpectedState atAttempt(Job job) {
        return new ExpectedState(job.getStatus(), job.getCurrentStage(), job.getStageRetryCount());
    }

    public boolean matches(Job job) {
        return job.getStatus() == status
                && job.getCurrentStage() == stage
                && (stageAttempt == null || job.getStageRetryCount() == stageAttempt);
    }

    /** The stored state in the same terms as this expectation, for conflict reports. */
    public ExpectedState actual(Job job) {
        return stageAttempt == null ? of(job) : atAttempt(job);
    }

    @Override
    public String toString() {
        return status.value()
                + (stage != null ? "(" + stage.value() + ")" : "")
                + (stageAttempt != null ? " attempt " + stageAttempt : "");
    }
}
