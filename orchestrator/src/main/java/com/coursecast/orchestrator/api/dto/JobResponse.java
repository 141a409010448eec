package com.coursecast.orchestrator.api.dto;

import com.coursecast.orchestrator.model.Job;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for job endpoints. Status, stage and error kind use the
 * lowercase wire values ("processing", "images", "validation").
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
        UUID                id,
        String              status,
        String              currentStage,
        int                 stageProgress,
        Instant             createdAt,
        Instant             updatedAt,
        Instant             completedAt,
        Instant             stageStartedAt,
        Map<String, Double> stageDurations,
        String              originalFilename,
        String              pdfPath,
        String              extractedTextPath,
        String              timelinePath,
        String              imagesPath,
        String              audioPath,
        String              videoPath,
        Double              videoDurationSeconds,
        Integer             slideCount,
        String              errorMessage,
        String              errorStage,
        String              errorKind,
        int                 retryCount,
        boolean             cancelRequested
) {
    public static JobResponse from(Job job) {
        return new JobResponse(
                job.getId(),
                job.getStatus().value(),
                job.getCurrentStage() != null ? job.getCurrentStage().value() : null,
                job.getStageProgress(),
                job.getCreatedAt(),
                job.getUpdatedAt(),
                job.getCompletedAt(),
                job.getStageStartedAt(),
                job.getStageDurations(),
                job.getOriginalFilename(),
                job.getPdfPath(),
                job.getExtractedTextPath(),
                job.getTimelinePath(),
                job.getImagesPath(),
                job.getAudioPath(),
                job.getVideoPath(),
                job.getVideoDurationSeconds(),
                job.getSlideCount(),
                job.getErrorMessage(),
                job.getErrorStage() != null ? job.getErrorStage().value() : null,
                job.getErrorKind() != null ? job.getErrorKind().value() : null,
                job.getRetryCount(),
                job.isCancelRequested()
        );
    }
}
