package com.coursecast.orchestrator.stage;

/**
 * Outcome of a successful stage. {@code slideCount} and
 * {@code videoDurationSeconds} are only set by render.
 */
public record StageResult(String artifactRef, Integer slideCount, Double videoDurationSeconds) {

    public static StageResult of(String artifactRef) {
        return new StageResult(artifactRef, null, null);
    }

    public static StageResult rendered(String videoRef, int slideCount, double videoDurationSeconds) {
        return new StageResult(videoRef, slideCount, videoDurationSeconds);
    }
}
