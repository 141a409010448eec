package com.coursecast.orchestrator.timeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * The authoritative description of the video: segments, their timing and
 * their narration. Produced once by the generate stage, validated before it
 * is stored, and read (never rewritten) by images, tts and render.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Timeline(
        String                version,
        String                title,
        String                topicSummary,
        String                targetAgeGroup,
        Double                totalDurationSeconds,
        List<TimelineSegment> segments
) {
    public List<String> segmentIds() {
        return segments.stream().map(TimelineSegment::segmentId).toList();
    }
}
