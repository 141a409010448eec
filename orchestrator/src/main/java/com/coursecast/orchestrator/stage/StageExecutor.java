package com.coursecast.orchestrator.stage;

import com.coursecast.orchestrator.model.PipelineStage;

/**
 * One pipeline stage: reads the artifacts of earlier stages, produces its
 * own, and returns the reference to record on the job.
 *
 * Implementations must be safe to re-run from scratch for the same job:
 * they write to deterministic artifact paths and overwrite whatever an
 * interrupted attempt left there.
 */
public interface StageExecutor {

    PipelineStage stage();

    /**
     * @throws StageException for every failure the executor can classify;
     *         anything else is treated as an internal error
     */
    StageResult execute(StageContext ctx) throws StageException;
}
