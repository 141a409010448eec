package com.coursecast.orchestrator.timeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One slide + one narration clip. duration_seconds is authoritative for
 * frame timing; generated audio has to fit inside it.
 *
 * Numeric fields are boxed so a missing value can be reported rather than
 * silently read as zero.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TimelineSegment(
        String segmentId,
        Double startTimeSeconds,
        Double durationSeconds,
        Slide  slide,
        String narrationText
) {
    @JsonIgnore
    public double endTimeSeconds() {
        return startTimeSeconds + durationSeconds;
    }
}
