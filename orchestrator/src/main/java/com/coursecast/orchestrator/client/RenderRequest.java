package com.coursecast.orchestrator.client;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.UUID;

/**
 * Body of POST {renderer}/render. Segments are in timeline order, each
 * carrying the absolute paths of its slide image and narration clip.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RenderRequest(
        UUID          jobId,
        String        outputPath,
        int           fps,
        int           width,
        int           height,
        String        title,
        double        totalDurationSeconds,
        List<Segment> segments
) {
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Segment(
            String       segmentId,
            double       startTimeSeconds,
            double       durationSeconds,
            String       title,
            List<String> bullets,
            String       narrationText,
            String       imagePath,
            String       audioPath
    ) {}
}
